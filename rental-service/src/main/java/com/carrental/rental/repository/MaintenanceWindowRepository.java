package com.carrental.rental.repository;

import com.carrental.rental.model.MaintenanceWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface MaintenanceWindowRepository
        extends JpaRepository<MaintenanceWindow, Long>, JpaSpecificationExecutor<MaintenanceWindow> {

    @Query("SELECT m FROM MaintenanceWindow m WHERE m.vehicle.id = :vehicleId AND m.endDate IS NULL " +
            "ORDER BY m.startDate ASC")
    List<MaintenanceWindow> findOpenByVehicleId(@Param("vehicleId") Long vehicleId);

    /**
     * Windows touching [start, end). Closed windows are inclusive of their end date.
     */
    @Query("SELECT m FROM MaintenanceWindow m WHERE m.vehicle.id = :vehicleId " +
            "AND m.startDate < :end AND (m.endDate IS NULL OR m.endDate >= :start) " +
            "ORDER BY m.startDate ASC, m.id ASC")
    List<MaintenanceWindow> findOverlapping(
            @Param("vehicleId") Long vehicleId,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end);

    @Query("SELECT m FROM MaintenanceWindow m WHERE m.vehicle.id = :vehicleId " +
            "AND (m.endDate IS NULL OR m.endDate >= :start) " +
            "ORDER BY m.startDate ASC, m.id ASC")
    List<MaintenanceWindow> findOverlappingFrom(
            @Param("vehicleId") Long vehicleId,
            @Param("start") LocalDate start);

    boolean existsByVehicle_Id(Long vehicleId);
}
