package com.distributedsystems.archon.service;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.model.IdentityEntity;
import com.distributedsystems.archon.repository.IBindingRepository;
import com.distributedsystems.archon.repository.IDidHistoryRepository;
import com.distributedsystems.archon.repository.IIdentityRepository;
import com.distributedsystems.archon.repository.IPollRepository;
import com.distributedsystems.archon.repository.IVoteRepository;
import com.distributedsystems.archon.service.view.IdentityView;
import com.distributedsystems.archon.signer.SignerAdapter;
import com.distributedsystems.archon.state.NodeState;
import com.distributedsystems.archon.util.DidCodec;
import com.distributedsystems.archon.util.IValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Lock failures while writing an identity: first provisioning converges on the stored row,
 * reprovisioning reports the failure.
 */
@ExtendWith(MockitoExtension.class)
class IdentityServiceRaceTest {

    private static final String KEY = "02" + "ab".repeat(32);

    @Mock private IIdentityRepository identityRepository;
    @Mock private IDidHistoryRepository historyRepository;
    @Mock private IBindingRepository bindingRepository;
    @Mock private IPollRepository pollRepository;
    @Mock private IVoteRepository voteRepository;
    @Mock private IValidator validator;
    @Mock private SignerAdapter signer;
    @Mock private OutboxService outboxService;
    @Mock private NodeState nodeState;
    @Mock private ArchonConfig config;
    @Mock private TransactionTemplate tx;

    @InjectMocks
    private IdentityService identityService;

    private final IdentityEntity stored = IdentityEntity.builder()
            .nodePubkey(KEY)
            .did(DidCodec.derive(KEY, 0))
            .createdAt(1_000L)
            .updatedAt(1_000L)
            .build();

    @BeforeEach
    void lockTimesOut() {
        when(validator.nodeKey(KEY)).thenReturn(KEY);
        when(tx.execute(any())).thenThrow(new PessimisticLockingFailureException("lock timeout"));
    }

    @Test
    void reprovisionUnderLockFailureIsReportedNotMaskedAsExisting() {
        Throwable thrown = catchThrowable(() -> identityService.provision(KEY, true));

        assertThat(thrown).isInstanceOf(ArchonException.class);
        assertThat(((ArchonException) thrown).getKind()).isEqualTo(ErrorKind.STORE_UNAVAILABLE);
        verify(identityRepository, never()).findById(any());
    }

    @Test
    void firstProvisionUnderLockFailureConvergesOnTheStoredIdentity() {
        when(identityRepository.findById(KEY)).thenReturn(Optional.of(stored));

        IdentityView view = identityService.provision(KEY, false);

        assertThat(view.did()).isEqualTo(stored.getDid());
        assertThat(view.alreadyProvisioned()).isTrue();
    }
}
