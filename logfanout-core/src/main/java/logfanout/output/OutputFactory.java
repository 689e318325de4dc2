package logfanout.output;

import logfanout.Output;
import logfanout.target.TargetConfig;

import java.io.IOException;

/**
 * Creates a live {@link Output} for a target. Used by the manager during reconciliation
 * and by target tests.
 */
@FunctionalInterface
public interface OutputFactory {

  /**
   * @param config a validated, enabled target
   * @return a connected output owned by the caller
   * @throws IOException if the output cannot be opened
   */
  Output create(TargetConfig config) throws IOException;
}
