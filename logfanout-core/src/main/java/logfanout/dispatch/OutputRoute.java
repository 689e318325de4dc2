package logfanout.dispatch;

import logfanout.LogLevel;

import java.util.Objects;

/**
 * One live target as seen by the dispatch hook: its queued output and the minimum level
 * it receives.
 */
public record OutputRoute(String targetId, String targetName, QueuedOutput output,
    LogLevel filterLevel) {

  public OutputRoute {
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(filterLevel, "filterLevel");
    targetName = targetName == null ? "" : targetName;
  }
}
