/**
 * Recovery orchestration package.
 *
 * <p>{@link io.mnemoshard.recovery.RecoverySession} owns one batch;
 * {@link io.mnemoshard.recovery.DecryptionCoordinator} runs the bounded password
 * loop over its encrypted entries and {@link io.mnemoshard.recovery.RecoveryEngine}
 * turns a ready batch into the secret.
 */
package io.mnemoshard.recovery;
