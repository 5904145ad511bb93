package com.ragmod.moderation.service.vector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of examples, positionally aligned with the rows of a vector index. A store is
 * assembled through its {@link Builder} and is read-only afterwards, so it can be shared by any
 * number of readers.
 */
public final class ExampleStore {

  private final List<Example> examples;

  private ExampleStore(List<Example> examples) {
    this.examples = Collections.unmodifiableList(examples);
  }

  public static ExampleStore of(List<Example> examples) {
    return new ExampleStore(new ArrayList<>(examples));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Example get(int position) {
    return examples.get(position);
  }

  public int size() {
    return examples.size();
  }

  public boolean isEmpty() {
    return examples.isEmpty();
  }

  public List<Example> asList() {
    return examples;
  }

  /** Append-only accumulator. */
  public static final class Builder {
    private final List<Example> pending = new ArrayList<>();

    private Builder() {}

    public Builder add(Example example) {
      pending.add(example);
      return this;
    }

    public Builder addAll(List<Example> more) {
      pending.addAll(more);
      return this;
    }

    public int size() {
      return pending.size();
    }

    public ExampleStore build() {
      return new ExampleStore(new ArrayList<>(pending));
    }
  }
}
