package com.tcgptracker.api.dto;

import com.tcgptracker.collection.RarityGroupProgress;
import com.tcgptracker.collection.SetProgress;
import lombok.Value;

import java.util.List;

/**
 * Collection progress of a set.
 */
@Value
public class SetProgressResponse {
    String setNumber;
    String setName;
    long collected;
    long total;
    double progressPercent;
    List<RarityGroupProgress> rarityProgress;

    public static SetProgressResponse of(SetProgress progress) {
        return new SetProgressResponse(
            progress.getSet().getNumber(),
            progress.getSet().getName(),
            progress.getCollected(),
            progress.getTotal(),
            progress.getProgressPercent(),
            progress.getRarityProgress()
        );
    }
}
