/**
 * Command line entry point ({@code tracker plan | run | aggregate}).
 *
 * <p>Exit codes: 0 on success (including runs where individual items failed),
 * 1 when the catalog or artifacts directory is missing or canonical state cannot be
 * read or written, 2 on invalid arguments.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tracker.application.cli;
