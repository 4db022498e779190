package com.fleetbot.fleet_ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@Entity
@Table(name = "weekly_ledger_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_ledger_vehicle_week", columnNames = {"vehicle_id", "week_start_date"}),
        indexes = @Index(name = "idx_ledger_week_window", columnList = "week_start_date, week_end_date"))
public class WeeklyLedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // One entry per vehicle per week; rows go away with their vehicle
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "vehicle_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    private Vehicle vehicle;

    @Column(name = "week_start_date", nullable = false)
    private LocalDate weekStartDate;

    @Column(name = "week_end_date", nullable = false)
    private LocalDate weekEndDate;

    // --- Revenue ---
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal cashCollected = BigDecimal.ZERO;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal onlineEarnings = BigDecimal.ZERO;

    // --- Deductions ---
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal dieselExpense = BigDecimal.ZERO;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal tollsParking = BigDecimal.ZERO;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal maintenanceRepairs = BigDecimal.ZERO;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal otherExpenses = BigDecimal.ZERO;

    // --- Derived (always recomputed by LedgerCalculator) ---
    @Column(nullable = false, precision = 16, scale = 2)
    private BigDecimal totalRevenue = BigDecimal.ZERO;

    @Column(nullable = false, precision = 16, scale = 2)
    private BigDecimal totalDeductions = BigDecimal.ZERO;

    @Column(nullable = false, precision = 16, scale = 2)
    private BigDecimal netProfit = BigDecimal.ZERO;

    @Column(nullable = false)
    private double profitMargin = 0;

    // --- Optional operational metrics ---
    private Integer totalTrips;
    private BigDecimal totalDistance;
    private Double averageRating;

    @Column(length = 1000)
    private String notes;

    private String submittedBy;
    private Instant submittedAt;
}
