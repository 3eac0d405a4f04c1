package io.mnemoshard.generation;

import java.util.ArrayList;
import java.util.List;

public record GenerationResult(
        int totalCount,
        int threshold,
        List<GeneratedShard> shards
) {
    public GenerationResult {
        shards = List.copyOf(shards);
    }

    public List<String> tokens() {
        List<String> out = new ArrayList<>();
        for (GeneratedShard shard : shards) {
            out.add(shard.token());
        }
        return out;
    }
}
