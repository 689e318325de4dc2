package logfanout.spi;

import logfanout.target.DuplicateTargetNameException;
import logfanout.target.LegacySettings;
import logfanout.target.TargetConfig;
import logfanout.target.TargetNotFoundException;
import logfanout.target.TargetValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistence contract for logging targets.
 *
 * <p>{@link #create} and {@link #update} validate the config first, so an invalid row is
 * never stored. Names are unique. Reads return fully populated configs with absent
 * columns resolved to empty strings or zero.
 *
 * @see logfanout.target.TargetValidator
 */
public interface TargetStore {

  /** All targets, ordered by name. */
  List<TargetConfig> list();

  /** Enabled targets only, ordered by name. */
  List<TargetConfig> listEnabled();

  /**
   * Loads one target.
   *
   * @param id target id
   * @return the stored config
   * @throws TargetNotFoundException if no target has this id
   */
  TargetConfig get(String id);

  /**
   * Validates and inserts a new target. A missing id is generated.
   *
   * @param cfg the target to insert
   * @return the stored config, with id and timestamps set
   * @throws TargetValidationException if the config is invalid
   * @throws DuplicateTargetNameException if the name is taken
   */
  TargetConfig create(TargetConfig cfg);

  /**
   * Validates and replaces an existing target.
   *
   * @param cfg the new state, identified by its id
   * @return the stored config with a fresh {@code updatedAt}
   * @throws TargetValidationException if the config is invalid
   * @throws TargetNotFoundException if no target has this id
   * @throws DuplicateTargetNameException if the new name is taken by another target
   */
  TargetConfig update(TargetConfig cfg);

  /**
   * Deletes a target.
   *
   * @param id target id
   * @throws TargetNotFoundException if no target has this id
   */
  void delete(String id);

  /**
   * Copies the legacy single syslog / single HTTP settings into the store.
   *
   * <p>Callers normally run this once, when the store is still empty. A legacy target
   * whose migrated name already exists is skipped, so a repeated call does not create
   * duplicates. Failures to insert a row are logged and do not stop the other row.
   *
   * @param settings the legacy settings source
   * @return the targets that were created
   */
  default List<TargetConfig> migrateFromLegacySettings(SettingsReader settings) {
    Logger logger = Logger.getLogger(TargetStore.class.getName());
    Set<String> existingNames = new HashSet<>();
    for (TargetConfig existing : list()) {
      existingNames.add(existing.name());
    }

    List<TargetConfig> created = new ArrayList<>(2);
    for (TargetConfig legacy : LegacySettings.readTargets(settings)) {
      if (existingNames.contains(legacy.name())) {
        logger.fine("Legacy logging target already migrated: " + legacy.name());
        continue;
      }
      try {
        created.add(create(legacy));
        logger.info("Migrated legacy " + legacy.type() + " logging settings to logging targets");
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to migrate legacy " + legacy.type() + " logging settings", e);
      }
    }
    return created;
  }
}
