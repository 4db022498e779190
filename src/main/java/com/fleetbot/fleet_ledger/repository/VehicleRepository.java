package com.fleetbot.fleet_ledger.repository;

import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.VehicleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    Optional<Vehicle> findByVehicleNumberIgnoreCase(String vehicleNumber);

    List<Vehicle> findByStatusOrderByVehicleNumberAsc(VehicleStatus status);

    List<Vehicle> findAllByOrderByVehicleNumberAsc();

    long countByStatus(VehicleStatus status);
}
