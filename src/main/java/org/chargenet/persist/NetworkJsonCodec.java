package org.chargenet.persist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.chargenet.network.ChargeNetwork;
import org.chargenet.network.ChargeStation;
import org.chargenet.network.Leg;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON import/export of a {@link ChargeNetwork}.
 *
 * <p>Station ids are dense integers assigned in vertex order at export time and carry
 * no meaning across exports. Import adds every station, then commits legs through
 * {@link ChargeNetwork#commitLegs(java.util.Collection)} so the range filter applies to
 * loaded documents too.</p>
 *
 * <p>The stream overloads leave the caller's stream open when the default mapper is used.</p>
 */
@Slf4j
public final class NetworkJsonCodec {
    private final ObjectMapper mapper;

    public NetworkJsonCodec() {
        this(JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                .build());
    }

    /**
     * Uses {@code mapper} as configured; whether the stream overloads close their
     * stream follows its auto-close features.
     */
    public NetworkJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void write(ChargeNetwork network, Path path) {
        Objects.requireNonNull(path, "path");
        try (OutputStream out = Files.newOutputStream(path)) {
            write(network, out);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write network to " + path, ex);
        }
    }

    /**
     * Writes {@code network} to {@code out}. The stream is flushed, not closed.
     */
    public void write(ChargeNetwork network, OutputStream out) {
        Objects.requireNonNull(out, "out");
        NetworkDocument document = toDocument(network);
        try {
            mapper.writeValue(out, document);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write network", ex);
        }
    }

    public String writeString(ChargeNetwork network) {
        NetworkDocument document = toDocument(network);
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("failed to serialise network", ex);
        }
    }

    public ChargeNetwork read(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read network from " + path, ex);
        }
    }

    /**
     * Reads a network from {@code in}, leaving the stream open.
     *
     * @throws NetworkFormatException when the document is malformed or inconsistent.
     */
    public ChargeNetwork read(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            return fromDocument(mapper.readValue(in, NetworkDocument.class));
        } catch (JsonProcessingException ex) {
            throw new NetworkFormatException("malformed network document: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read network", ex);
        }
    }

    /**
     * @throws NetworkFormatException when the document is malformed or inconsistent.
     */
    public ChargeNetwork readString(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return fromDocument(mapper.readValue(json, NetworkDocument.class));
        } catch (JsonProcessingException ex) {
            throw new NetworkFormatException("malformed network document: " + ex.getOriginalMessage(), ex);
        }
    }

    NetworkDocument toDocument(ChargeNetwork network) {
        Objects.requireNonNull(network, "network");
        Reference2IntOpenHashMap<ChargeStation> ids = new Reference2IntOpenHashMap<>();
        Map<String, StationDocument> stations = new LinkedHashMap<>();
        for (ChargeStation station : network.stations()) {
            int id = ids.size();
            ids.put(station, id);
            stations.put(Integer.toString(id), toDocument(station));
        }

        List<LegDocument> legs = new ArrayList<>();
        for (Leg leg : network.legs()) {
            legs.add(new LegDocument(
                    List.of(
                            Integer.toString(ids.getInt(leg.endpoints().first())),
                            Integer.toString(ids.getInt(leg.endpoints().second()))),
                    leg.drivingDistanceMeters(),
                    leg.drivingTimeSeconds()));
        }

        log.info("exporting network with {} charge stations and {} legs", stations.size(), legs.size());
        return new NetworkDocument(
                network.minChargersAtStation(),
                network.evRangeMeters(),
                new GraphDocument(stations, legs));
    }

    ChargeNetwork fromDocument(NetworkDocument document) {
        if (document.getGraph() == null) {
            throw new NetworkFormatException("document has no graph");
        }
        ChargeNetwork network;
        try {
            network = new ChargeNetwork(document.getMinChargersAtStation(), document.getEvRange());
        } catch (IllegalArgumentException ex) {
            throw new NetworkFormatException(ex.getMessage(), ex);
        }

        Int2ObjectOpenHashMap<ChargeStation> byId = new Int2ObjectOpenHashMap<>();
        for (Map.Entry<String, StationDocument> entry : document.getGraph().getChargeStations().entrySet()) {
            int id = parseId(entry.getKey());
            if (byId.containsKey(id)) {
                throw new NetworkFormatException("duplicate charge station id: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new NetworkFormatException("charge station " + id + " has no record");
            }
            ChargeStation station = toStation(id, entry.getValue());
            byId.put(id, station);
            network.addStation(station);
        }

        List<Leg> legs = new ArrayList<>(document.getGraph().getLegs().size());
        for (LegDocument leg : document.getGraph().getLegs()) {
            legs.add(toLeg(leg, byId));
        }
        int admitted = network.commitLegs(legs);
        if (admitted < legs.size()) {
            log.warn("dropped {} of {} legs longer than the network range", legs.size() - admitted, legs.size());
        }
        return network;
    }

    private static StationDocument toDocument(ChargeStation station) {
        return new StationDocument(
                station.name(),
                station.address(),
                station.hours(),
                station.phone(),
                station.latitude(),
                station.longitude(),
                station.openDate() == null ? null : station.openDate().toString());
    }

    private static ChargeStation toStation(int id, StationDocument document) {
        if (document.getLat() == null || document.getLng() == null) {
            throw new NetworkFormatException("charge station " + id + " has no coordinate");
        }
        LocalDate openDate = null;
        if (document.getOpenDate() != null) {
            try {
                openDate = LocalDate.parse(document.getOpenDate());
            } catch (DateTimeParseException ex) {
                throw new NetworkFormatException("charge station " + id + " has a bad open_date: "
                        + document.getOpenDate(), ex);
            }
        }
        return ChargeStation.builder()
                .name(document.getName())
                .address(document.getAddress())
                .hours(document.getHours())
                .phone(document.getPhone())
                .latitude(document.getLat())
                .longitude(document.getLng())
                .openDate(openDate)
                .build();
    }

    private static Leg toLeg(LegDocument document, Int2ObjectOpenHashMap<ChargeStation> byId) {
        List<String> endpointIds = document.getEndpointIds();
        if (endpointIds.size() != 2) {
            throw new NetworkFormatException("leg must have exactly 2 endpoint ids, got " + endpointIds);
        }
        ChargeStation first = byId.get(parseId(endpointIds.get(0)));
        ChargeStation second = byId.get(parseId(endpointIds.get(1)));
        if (first == null || second == null) {
            throw new NetworkFormatException("leg references an unknown charge station id: " + endpointIds);
        }
        try {
            return new Leg(first, second, document.getDrivingDistance(), document.getDrivingTime());
        } catch (IllegalArgumentException ex) {
            throw new NetworkFormatException("invalid leg " + endpointIds + ": " + ex.getMessage(), ex);
        }
    }

    private static int parseId(String id) {
        try {
            return Integer.parseInt(id);
        } catch (NumberFormatException ex) {
            throw new NetworkFormatException("charge station id is not an integer: " + id, ex);
        }
    }
}
