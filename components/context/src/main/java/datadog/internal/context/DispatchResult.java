package datadog.internal.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Outcome of one {@link EventHub#dispatch(String, Object...)} call: one result slot and one error
 * slot per listener, in registration order. A listener that failed has a {@code null} result and
 * its error recorded; a listener that succeeded has a {@code null} error.
 */
public final class DispatchResult {
  static final DispatchResult EMPTY =
      new DispatchResult(Collections.emptyList(), Collections.emptyList());

  private final List<Object> results;
  private final List<Throwable> errors;

  DispatchResult(List<Object> results, List<Throwable> errors) {
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
    this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
  }

  public List<Object> getResults() {
    return results;
  }

  public List<Throwable> getErrors() {
    return errors;
  }

  @Nullable
  public Object getResult(int index) {
    return results.get(index);
  }

  @Nullable
  public Throwable getError(int index) {
    return errors.get(index);
  }

  /** Number of listeners that were invoked. */
  public int size() {
    return results.size();
  }

  public boolean hasErrors() {
    for (Throwable error : errors) {
      if (error != null) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "DispatchResult{results=" + results + ", errors=" + errors + '}';
  }
}
