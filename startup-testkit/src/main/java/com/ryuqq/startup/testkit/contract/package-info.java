/**
 * Contract test support.
 *
 * <p>{@link com.ryuqq.startup.testkit.contract.ComponentGraph} records create calls of a
 * dependency graph; {@link com.ryuqq.startup.testkit.contract.AbstractContractTest} wires it
 * to an orchestrator implementation for each test.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.testkit.contract;
