/**
 * Verity source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.verity.Main} bootstraps the {@code verify} CLI process.</li>
 *   <li>{@code io.verity.cli.VerifyCommand} maps commands to engine APIs.</li>
 *   <li>{@code io.verity.runtime.VerificationEngine} wires the verifiers, scenarios, statistics and history.</li>
 *   <li>{@code io.verity.registry.RegistryStore} is the authoritative owner of verification state.</li>
 * </ul>
 */
package io.verity;
