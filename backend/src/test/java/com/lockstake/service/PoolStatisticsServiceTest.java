package com.lockstake.service;

import com.lockstake.config.LockstakeProperties;
import com.lockstake.exception.StakingErrorCode;
import com.lockstake.exception.StakingException;
import com.lockstake.model.RewardSchedule;
import com.lockstake.repository.InMemoryRewardScheduleRepository;
import com.lockstake.repository.InMemoryStakeRecordRepository;
import com.lockstake.repository.InMemoryStakerRosterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class PoolStatisticsServiceTest {

    private static final long T0 = 1_700_000_000L;
    private static final long DAY = RewardSchedule.SECONDS_PER_DAY;
    private static final String OPERATOR = "operator";

    @Mock
    private AssetTransferGateway assetTransferGateway;

    private RewardScheduleService rewardScheduleService;
    private MutableLedgerClock clock;
    private StakeLedgerService stakeLedgerService;
    private PoolStatisticsService poolStatisticsService;

    @BeforeEach
    void setUp() {
        LockstakeProperties properties = new LockstakeProperties();
        properties.setOperator(OPERATOR);
        InMemoryStakeRecordRepository stakeRecordRepository = new InMemoryStakeRecordRepository();
        InMemoryStakerRosterRepository stakerRosterRepository = new InMemoryStakerRosterRepository();
        rewardScheduleService = new RewardScheduleService(
                new InMemoryRewardScheduleRepository(),
                new ConfiguredOperatorAccessGuard(properties),
                properties
        );
        rewardScheduleService.initialize();
        clock = new MutableLedgerClock(T0);
        stakeLedgerService = new StakeLedgerService(
                stakeRecordRepository, stakerRosterRepository, rewardScheduleService, assetTransferGateway, clock);
        poolStatisticsService = new PoolStatisticsService(
                stakerRosterRepository, stakeRecordRepository, rewardScheduleService);

        lenient().when(assetTransferGateway.pullFrom(anyString(), anyLong())).thenReturn(true);
        lenient().when(assetTransferGateway.pushTo(anyString(), anyLong())).thenReturn(true);
    }

    @Test
    void emptyLedgerReportsZeros() {
        assertEquals(0, poolStatisticsService.participantCount());
        assertEquals(0, poolStatisticsService.activeParticipantCount());
        assertEquals(0L, poolStatisticsService.poolTotal());
    }

    @Test
    void poolTotalSumsActivePrincipal() {
        stakeLedgerService.stake("alice", 1_000L, 0);
        stakeLedgerService.stake("bob", 2_500L, 1);
        stakeLedgerService.stake("carol", 700L, 2);

        assertEquals(3, poolStatisticsService.participantCount());
        assertEquals(3, poolStatisticsService.activeParticipantCount());
        assertEquals(4_200L, poolStatisticsService.poolTotal());
    }

    @Test
    void unstakedAccountsStayInHistoricalCountButLeavePoolTotal() {
        stakeLedgerService.stake("alice", 1_000L, 0);
        stakeLedgerService.stake("bob", 2_500L, 1);
        clock.advance(90 * DAY);
        stakeLedgerService.unstake("alice");

        assertEquals(2, poolStatisticsService.participantCount());
        assertEquals(1, poolStatisticsService.activeParticipantCount());
        assertEquals(2_500L, poolStatisticsService.poolTotal());
    }

    @Test
    void reStakedAccountIsCountedTwiceButSummedOnce() {
        stakeLedgerService.stake("alice", 1_000L, 0);
        clock.advance(90 * DAY);
        stakeLedgerService.unstake("alice");
        stakeLedgerService.stake("alice", 3_000L, 0);

        assertEquals(2, poolStatisticsService.participantCount());
        assertEquals(1, poolStatisticsService.activeParticipantCount());
        assertEquals(3_000L, poolStatisticsService.poolTotal());
    }

    @Test
    void restakeDoesNotGrowRoster() {
        stakeLedgerService.stake("alice", 1_000L, 0);
        clock.advance(90 * DAY);
        stakeLedgerService.restake("alice", 2);

        assertEquals(1, poolStatisticsService.participantCount());
        assertEquals(1_000L, poolStatisticsService.poolTotal());
    }

    @Test
    void estimateDailyRateUsesCatalogEntry() {
        assertEquals(1L, poolStatisticsService.estimateDailyRate(1_000L, 0));
        // 2469 / 180 = 13
        assertEquals(13L, poolStatisticsService.estimateDailyRate(12_345L, 1));
        // 400000 / 360 = 1111
        assertEquals(1_111L, poolStatisticsService.estimateDailyRate(1_000_000L, 2));
    }

    @Test
    void estimateDailyRateQuotesDisabledScheduleAndRejectsUnknownIndex() {
        rewardScheduleService.disable(OPERATOR, 0);

        assertEquals(1L, poolStatisticsService.estimateDailyRate(1_000L, 0));
        StakingException ex = assertThrows(StakingException.class,
                () -> poolStatisticsService.estimateDailyRate(1_000L, 5));
        assertEquals(StakingErrorCode.INDEX_OUT_OF_RANGE, ex.getCode());
    }
}
