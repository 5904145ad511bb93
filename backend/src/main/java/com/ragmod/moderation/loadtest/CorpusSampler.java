package com.ragmod.moderation.loadtest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.ragmod.moderation.service.corpus.CorpusRecord;

/** Draws a bounded subset from a larger corpus. */
public final class CorpusSampler {

  private CorpusSampler() {}

  /** Up to {@code n} records in random order; the whole corpus when it is not larger than n. */
  public static List<CorpusRecord> random(List<CorpusRecord> records, int n, Random random) {
    List<CorpusRecord> shuffled = new ArrayList<>(records);
    if (n >= records.size()) {
      return shuffled;
    }
    Collections.shuffle(shuffled, random);
    return new ArrayList<>(shuffled.subList(0, n));
  }

  /**
   * Proportional per-category sampling: {@code max(1, n / categories)} records from each labeled
   * category (or all of a smaller one), then the remainder drawn randomly from records not yet
   * taken. With many categories and a small n the result can exceed n, since every category keeps
   * at least one record. Falls back to {@link #random} when nothing is labeled.
   */
  public static List<CorpusRecord> stratified(List<CorpusRecord> records, int n, Random random) {
    if (n >= records.size()) {
      return new ArrayList<>(records);
    }
    Map<String, List<CorpusRecord>> byLabel = new LinkedHashMap<>();
    for (CorpusRecord record : records) {
      if (record.getLabel() != null) {
        byLabel.computeIfAbsent(record.getLabel(), k -> new ArrayList<>()).add(record);
      }
    }
    if (byLabel.isEmpty()) {
      return random(records, n, random);
    }

    int perCategory = Math.max(1, n / byLabel.size());
    int remainder = n - perCategory * byLabel.size();

    List<CorpusRecord> sampled = new ArrayList<>();
    Set<CorpusRecord> taken = Collections.newSetFromMap(new IdentityHashMap<>());
    for (List<CorpusRecord> group : byLabel.values()) {
      for (CorpusRecord record : random(group, Math.min(perCategory, group.size()), random)) {
        sampled.add(record);
        taken.add(record);
      }
    }

    if (remainder > 0) {
      List<CorpusRecord> rest = new ArrayList<>();
      for (CorpusRecord record : records) {
        if (!taken.contains(record)) {
          rest.add(record);
        }
      }
      sampled.addAll(random(rest, Math.min(remainder, rest.size()), random));
    }
    return sampled;
  }
}
