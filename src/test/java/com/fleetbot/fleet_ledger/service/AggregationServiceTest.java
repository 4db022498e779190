package com.fleetbot.fleet_ledger.service;

import com.fleetbot.fleet_ledger.config.FleetLedgerProperties;
import com.fleetbot.fleet_ledger.dto.FleetStats;
import com.fleetbot.fleet_ledger.dto.TrendPoint;
import com.fleetbot.fleet_ledger.exception.StorageException;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.VehicleStatus;
import com.fleetbot.fleet_ledger.repository.VehicleRepository;
import com.fleetbot.fleet_ledger.repository.WeeklyLedgerEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDate;
import java.util.List;

import static com.fleetbot.fleet_ledger.LedgerTestData.FIXED_CLOCK;
import static com.fleetbot.fleet_ledger.LedgerTestData.MONDAY;
import static com.fleetbot.fleet_ledger.LedgerTestData.SUNDAY;
import static com.fleetbot.fleet_ledger.LedgerTestData.activeVehicle;
import static com.fleetbot.fleet_ledger.LedgerTestData.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregationServiceTest {

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private WeeklyLedgerEntryRepository entryRepository;

    private FleetLedgerProperties properties;
    private AggregationService aggregationService;

    @BeforeEach
    void setUp() {
        properties = new FleetLedgerProperties();
        aggregationService = new AggregationService(vehicleRepository, entryRepository, properties, FIXED_CLOCK);
    }

    @Test
    @DisplayName("Without a week start the current week is summarized")
    void defaultsToCurrentWeek() {
        Vehicle v1 = activeVehicle(1L, "ABC123");
        when(vehicleRepository.count()).thenReturn(3L);
        when(vehicleRepository.countByStatus(VehicleStatus.ACTIVE)).thenReturn(2L);
        when(entryRepository.findByWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByIdAsc(MONDAY, SUNDAY))
                .thenReturn(List.of(entry(10L, v1, MONDAY, 8000, 3000)));

        FleetStats stats = aggregationService.getFleetStats(null);

        assertThat(stats.getWeekStart()).isEqualTo(MONDAY);
        assertThat(stats.getWeekEnd()).isEqualTo(SUNDAY);
        assertThat(stats.getTotalVehicles()).isEqualTo(3);
        assertThat(stats.getActiveVehicles()).isEqualTo(2);
        assertThat(stats.getWeeklyRevenue()).isEqualByComparingTo("8000");
        assertThat(stats.getWeeklyProfit()).isEqualByComparingTo("5000");
        assertThat(stats.getAverageProfitMargin()).isEqualTo(62.5);
        assertThat(stats.getTopPerformers()).hasSize(1);
    }

    @Test
    void explicitWeekStart() {
        LocalDate start = LocalDate.of(2025, 9, 1);
        when(entryRepository.findByWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByIdAsc(
                start, LocalDate.of(2025, 9, 7))).thenReturn(List.of());

        FleetStats stats = aggregationService.getFleetStats(start);

        assertThat(stats.getWeekStart()).isEqualTo(start);
        assertThat(stats.getWeeklyRevenue()).isEqualByComparingTo("0");
        assertThat(stats.getAverageProfitMargin()).isZero();
        assertThat(stats.getTopPerformers()).isEmpty();
    }

    @Test
    @DisplayName("Trend length falls back to the configured default")
    void trendUsesConfiguredDefault() {
        properties.getTrend().setDefaultWeeks(6);
        when(entryRepository.findByOrderByWeekStartDateDescIdDesc(PageRequest.of(0, 6))).thenReturn(List.of());

        List<TrendPoint> trend = aggregationService.getTrend(null, null);

        assertThat(trend).isEmpty();
        verify(entryRepository).findByOrderByWeekStartDateDescIdDesc(PageRequest.of(0, 6));
    }

    @Test
    void trendForOneVehicleIsOldestFirst() {
        Vehicle v1 = activeVehicle(1L, "ABC123");
        when(entryRepository.findByVehicle_IdOrderByWeekStartDateDescIdDesc(1L, PageRequest.of(0, 2)))
                .thenReturn(List.of(entry(2L, v1, MONDAY, 200, 50), entry(1L, v1, MONDAY.minusWeeks(1), 100, 50)));

        List<TrendPoint> trend = aggregationService.getTrend(1L, 2);

        assertThat(trend).extracting(TrendPoint::getWeek).containsExactly(MONDAY.minusWeeks(1), MONDAY);
    }

    @Test
    void rejectsNonPositiveWeeks() {
        assertThatThrownBy(() -> aggregationService.getTrend(null, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Number of weeks must be at least 1");

        verifyNoInteractions(entryRepository);
    }

    @Test
    void wrapsStorageFailure() {
        when(vehicleRepository.count()).thenThrow(new QueryTimeoutException("timed out"));

        assertThatThrownBy(() -> aggregationService.getFleetStats(MONDAY))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("timed out");
    }
}
