package logfanout.dispatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable list of routes the hook fans entries out to. A new snapshot is built after
 * every reconfiguration and replaces the previous one atomically; a snapshot is never
 * modified once published.
 */
public record DispatchSnapshot(List<OutputRoute> routes) {

  public static final DispatchSnapshot EMPTY = new DispatchSnapshot(List.of());

  public DispatchSnapshot {
    routes = List.copyOf(routes);
  }

  /**
   * Builds a snapshot ordered by target name, then id.
   *
   * @param routes the live routes
   * @return the snapshot
   */
  public static DispatchSnapshot of(Collection<OutputRoute> routes) {
    List<OutputRoute> sorted = new ArrayList<>(routes);
    sorted.sort(Comparator.comparing(OutputRoute::targetName).thenComparing(OutputRoute::targetId));
    return new DispatchSnapshot(sorted);
  }

  public int size() {
    return routes.size();
  }

  public boolean isEmpty() {
    return routes.isEmpty();
  }
}
