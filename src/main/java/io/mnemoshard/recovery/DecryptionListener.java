package io.mnemoshard.recovery;

import io.mnemoshard.model.DecryptionAttempt;
import io.mnemoshard.model.RecoveryVerdict;

import java.util.List;

public interface DecryptionListener {
    DecryptionListener NONE = (pass, attempts, verdict) -> {
    };

    void onPassCompleted(int pass, List<DecryptionAttempt> attempts, RecoveryVerdict verdict);
}
