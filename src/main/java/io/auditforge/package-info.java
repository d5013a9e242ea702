/**
 * AuditForge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.auditforge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.auditforge.cli.AuditForgeCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.auditforge.runtime.AuditForgeRuntime} drives runs and phases, stacking and resume.</li>
 *   <li>{@code io.auditforge.storage.StateStore} is the authoritative record of run progress.</li>
 * </ul>
 */
package io.auditforge;
