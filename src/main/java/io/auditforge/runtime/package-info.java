/**
 * Runtime orchestration package.
 *
 * <p>{@link io.auditforge.runtime.AuditForgeRuntime} owns cross-cutting behavior: run start and
 * archiving, stacking through the delta engine, phase eligibility, batch dispatch, quality gating,
 * coverage follow-up and finding evolution.
 */
package io.auditforge.runtime;
