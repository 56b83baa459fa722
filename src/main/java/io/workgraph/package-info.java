/**
 * WorkGraph source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.workgraph.cli.WorkGraphCommand} maps commands to runtime APIs and exit codes.</li>
 *   <li>{@code io.workgraph.runtime.WorkGraphRuntime} owns the issue lifecycle and wires the engine together.</li>
 *   <li>{@code io.workgraph.flow.FlowControlPlane} runs claim-next, close-safe and block-with-context atomically.</li>
 *   <li>{@code io.workgraph.storage.SqliteIssueStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.workgraph;
