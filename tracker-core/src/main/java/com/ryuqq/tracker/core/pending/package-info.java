/**
 * Pending-set computation.
 *
 * <p>{@link com.ryuqq.tracker.core.pending.PendingSetResolver} turns a
 * {@link com.ryuqq.tracker.core.model.StateSnapshot} into an ordered
 * {@link com.ryuqq.tracker.core.pending.PendingSet}: never-attempted items first,
 * then previously failed ones, each sorted by id.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.pending;
