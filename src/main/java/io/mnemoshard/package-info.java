/**
 * MnemoShard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.mnemoshard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.mnemoshard.cli.MnemoShardCommand} maps commands to the engines.</li>
 *   <li>{@code io.mnemoshard.generation.GenerationEngine} splits a phrase into shards.</li>
 *   <li>{@code io.mnemoshard.recovery.RecoveryEngine} classifies, validates, decrypts and combines a batch.</li>
 * </ul>
 */
package io.mnemoshard;
