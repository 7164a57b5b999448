/**
 * LaunchPad source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.launchpad.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.launchpad.cli.LaunchPadCommand} maps commands to store operations.</li>
 *   <li>{@code io.launchpad.LaunchPad} composes allocation, insertion, refresh, checkout and completion.</li>
 *   <li>{@code io.launchpad.storage.Database} owns the SQLite file and its transactions.</li>
 * </ul>
 */
package io.launchpad;
