package com.distributedsystems.archon.service.view;

import java.util.List;

public record PollStatusView(PollView poll, Tally tally, List<VoteView> votes) {
}
