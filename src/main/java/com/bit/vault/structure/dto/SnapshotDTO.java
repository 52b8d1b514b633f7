package com.bit.vault.structure.dto;

import com.bit.vault.structure.oracle.RewardsSnapshot;
import lombok.Data;

@Data
public class SnapshotDTO {
    private String rewardsRoot;
    private String prevRewardsRoot;
    private long nonce;
    private long updateTimestamp;

    public static SnapshotDTO from(RewardsSnapshot snapshot) {
        SnapshotDTO dto = new SnapshotDTO();
        dto.setRewardsRoot(snapshot.getRewardsRoot().toHex());
        dto.setPrevRewardsRoot(snapshot.getPrevRewardsRoot().toHex());
        dto.setNonce(snapshot.getNonce());
        dto.setUpdateTimestamp(snapshot.getUpdateTimestamp());
        return dto;
    }
}
