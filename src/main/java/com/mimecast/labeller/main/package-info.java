/**
 * Component wiring and the command line front end.
 *
 * <h2>Foundation</h2>
 * <p>Builds the store, quota guard, session manager, classifier and engines once per process.
 * <br>The data source is migrated before anything else touches it.
 *
 * <h2>LabellerCLI</h2>
 * <p>One method per command. Failures print {@code error[<kind>]: <message>} and return exit code 1.
 */
package com.mimecast.labeller.main;
