package com.distributedsystems.archon.service.view;

import com.distributedsystems.archon.model.VoteEntity;

import java.util.List;

public record VoteView(String voteId,
                       String pollId,
                       String voterPubkey,
                       String voterDid,
                       Object choice,
                       String choiceLabel,
                       String reason,
                       String signature,
                       long votedAt) {

    public static VoteView of(VoteEntity v, List<String> options) {
        return new VoteView(v.getVoteId(), v.getPollId(), v.getVoterPubkey(), v.getVoterDid(),
                v.choice().wireValue(), options == null ? null : v.choice().label(options),
                v.getReason(), v.getSignature(), v.getVotedAt());
    }
}
