package com.fleetbot.fleet_ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Vehicle master data. Owned by the vehicle-management side; the ledger only reads it.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "vehicles")
public class Vehicle {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Registration plate, stored upper-case
    @Column(name = "vehicle_number", unique = true, nullable = false)
    private String vehicleNumber;

    @Column(nullable = false)
    private String driverName;

    @Column(nullable = false)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private VehicleStatus status = VehicleStatus.ACTIVE;

    @Column(length = 1000)
    private String notes;

    public Vehicle(String vehicleNumber, String driverName, String phoneNumber, VehicleStatus status) {
        this.vehicleNumber = vehicleNumber;
        this.driverName = driverName;
        this.phoneNumber = phoneNumber;
        this.status = status;
    }

    public boolean isActive() {
        return status == VehicleStatus.ACTIVE;
    }

    @PrePersist
    @PreUpdate
    void normalizeVehicleNumber() {
        if (vehicleNumber != null) {
            vehicleNumber = vehicleNumber.trim().toUpperCase(Locale.ROOT);
        }
    }
}
