package com.foliovault.audit;

import com.foliovault.domain.LedgerEvent;
import com.foliovault.domain.LedgerEventRepository;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.LedgerRecordedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerEventRecorderTest {

    private static final Instant COMMITTED_AT = Instant.parse("2025-01-01T12:00:00Z");

    @Mock
    LedgerEventRepository ledgerEventRepository;

    @InjectMocks
    LedgerEventRecorder recorder;

    private static LedgerRecordedEvent stakeAndClaim() {
        return new LedgerRecordedEvent(7L, "stake", COMMITTED_AT, List.of(
                LedgerRecord.of(LedgerEventType.STAKED, "0xa11ce", "amount", 100),
                LedgerRecord.of(LedgerEventType.STAKING_REWARD_CLAIMED, "0xa11ce", "reward", 1)));
    }

    @Test
    @DisplayName("one document per record, sequenced in emission order and stamped with commit time")
    @SuppressWarnings("unchecked")
    void persistsDocuments() {
        recorder.onLedgerRecorded(stakeAndClaim());

        ArgumentCaptor<List<LedgerEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledgerEventRepository).saveAll(captor.capture());
        List<LedgerEvent> saved = captor.getValue();

        assertThat(saved).hasSize(2);
        assertThat(saved).extracting(LedgerEvent::getSequence).containsExactly(0, 1);
        assertThat(saved).extracting(LedgerEvent::getType)
                .containsExactly(LedgerEventType.STAKED, LedgerEventType.STAKING_REWARD_CLAIMED);
        assertThat(saved).allSatisfy(e -> {
            assertThat(e.getTransitionId()).isEqualTo(7L);
            assertThat(e.getOperation()).isEqualTo("stake");
            assertThat(e.getAccount()).isEqualTo("0xa11ce");
            assertThat(e.getRecordedAt()).isEqualTo(COMMITTED_AT);
        });
        assertThat(saved.get(0).getAttributes()).containsEntry("amount", "100");
    }

    @Test
    @DisplayName("event without records does not touch the repository")
    void emptyEventIgnored() {
        recorder.onLedgerRecorded(new LedgerRecordedEvent(1L, "noop", COMMITTED_AT, List.of()));

        verify(ledgerEventRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("database failure is logged and dropped")
    void persistenceFailureDropped() {
        when(ledgerEventRepository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> recorder.onLedgerRecorded(stakeAndClaim())).doesNotThrowAnyException();
    }
}
