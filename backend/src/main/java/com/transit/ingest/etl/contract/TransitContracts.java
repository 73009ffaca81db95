package com.transit.ingest.etl.contract;

import static com.transit.ingest.etl.contract.ContractField.decimal;
import static com.transit.ingest.etl.contract.ContractField.integer;
import static com.transit.ingest.etl.contract.ContractField.string;
import static com.transit.ingest.etl.contract.ContractField.timestamp;

/**
 * Contracts for the bus endpoints of the transit API.
 */
public final class TransitContracts {
    public static final String BUS_STOPS = "bus-stops";
    public static final String BUS_POSITIONS = "bus-positions";
    public static final String BUS_STOP_ROUTES = "bus-stop-routes";

    private TransitContracts() {}

    public static DataContract busStops() {
        return DataContract.builder(BUS_STOPS, "bus_stops")
            .field(integer("stop_id").from("StopID").required().min("0"))
            .field(string("stop_name").from("Name").required().maxLength(200))
            .field(decimal("lat").from("Lat").required().min("-90").max("90"))
            .field(decimal("lon").from("Lon").required().min("-180").max("180"))
            .naturalKey("stop_id")
            .build();
    }

    /**
     * One row per route served by a stop, read from the {@code Routes} array of the stops payload.
     */
    public static DataContract busStopRoutes() {
        return DataContract.builder(BUS_STOP_ROUTES, "bus_stop_routes")
            .field(integer("stop_id").from("StopID").required().min("0"))
            .field(string("route_id").from("Routes").required().upperCase().maxLength(16).exploded())
            .naturalKey("stop_id", "route_id")
            .build();
    }

    public static DataContract busPositions() {
        return DataContract.builder(BUS_POSITIONS, "bus_positions")
            .field(integer("vehicle_id").from("VehicleID").required().min("0"))
            .field(timestamp("reported_at").from("DateTime").required())
            .field(integer("trip_id").from("TripID").min("0"))
            .field(string("route_id").from("RouteID").required().upperCase().maxLength(16))
            .field(integer("direction_num").from("DirectionNum").min("0"))
            .field(string("direction_text").from("DirectionText").upperCase().maxLength(32)
                .allowed("NORTHBOUND", "SOUTHBOUND", "EASTBOUND", "WESTBOUND", "LOOP", "CLOCKWISE", "COUNTERCLOCKWISE"))
            .field(decimal("lat").from("Lat").required().min("-90").max("90"))
            .field(decimal("lon").from("Lon").required().min("-180").max("180"))
            .field(decimal("deviation").from("Deviation"))
            .field(timestamp("trip_start_time").from("TripStartTime"))
            .field(timestamp("trip_end_time").from("TripEndTime"))
            .field(string("block_number").from("BlockNumber").maxLength(32).defaultValue("UNASSIGNED"))
            .field(timestamp("observed_at").extractionTime())
            .naturalKey("vehicle_id", "reported_at")
            .build();
    }
}
