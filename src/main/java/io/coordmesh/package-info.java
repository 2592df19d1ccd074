/**
 * CoordMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.coordmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.coordmesh.cli.CoordMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.coordmesh.runtime.CoordinationRuntime} wires the services, loads settings, gates and audits.</li>
 *   <li>{@code io.coordmesh.storage.Database} owns the schema, migrations and seed data.</li>
 * </ul>
 */
package io.coordmesh;
