package com.netgraph.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.netgraph.core.codec.ModuleDocument.InstanceDocument;
import com.netgraph.core.codec.ModuleDocument.NetDocument;
import com.netgraph.core.codec.ModuleDocument.PinDocument;
import com.netgraph.core.codec.ModuleDocument.PortDocument;
import com.netgraph.core.codec.ModuleDocument.PortsDocument;
import com.netgraph.core.error.ErrorKind;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.model.BitRange;
import com.netgraph.core.model.CellType;
import com.netgraph.core.model.Diagnostic;
import com.netgraph.core.model.DiagnosticKind;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.NetRef;
import com.netgraph.core.model.NetType;
import com.netgraph.core.model.NetlistResult;
import com.netgraph.core.model.Port;
import com.netgraph.core.parser.InstanceBuilder;
import com.netgraph.core.parser.ModuleBuilder;
import com.netgraph.core.parser.NetlistPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the JSON exchange format.
 *
 * <p>Writing is lossless for names, types and widths. Reading is deliberately coarser
 * than the body parser:
 * <ul>
 *   <li>Collection nets are typed by name: {@code '} means constant, {@code [} means
 *       {@code wire-sub}, anything else is a {@code wire}. The last net of a name wins
 *       pin lookups.</li>
 *   <li>A pin naming a constant or an indexed net gets a fresh net of that kind; any
 *       other name is shared through the module's name map.</li>
 *   <li>A pin whose net is missing from the document is left unresolved and reported as
 *       a diagnostic.</li>
 *   <li>Port derived-net lists are not restored.</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * JsonNetlistCodec codec = new JsonNetlistCodec();
 * codec.write(result.modules(), Path.of("parsed_objects.json"));
 * NetlistResult reloaded = codec.read(Path.of("parsed_objects.json"));
 * }</pre>
 */
public class JsonNetlistCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonNetlistCodec.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<List<ModuleDocument>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    // ==================== Writing ====================

    /**
     * Serializes modules to JSON text.
     *
     * @param modules modules to serialize
     * @return JSON array of module records
     * @throws NetlistException with {@link ErrorKind#IO_ERROR} if serialization fails
     */
    public String toJson(List<Module> modules) throws NetlistException {
        Objects.requireNonNull(modules, "modules must not be null");
        try {
            return JSON_MAPPER.writeValueAsString(modules.stream().map(this::toDocument).toList());
        } catch (JsonProcessingException e) {
            throw new NetlistException(ErrorKind.IO_ERROR, "Failed to serialize modules", e);
        }
    }

    /**
     * Writes modules to a JSON file, creating parent directories.
     *
     * @param modules modules to serialize
     * @param file target file, overwritten if present
     * @throws NetlistException with {@link ErrorKind#IO_ERROR} if the file cannot be written
     */
    public void write(List<Module> modules, Path file) throws NetlistException {
        Objects.requireNonNull(file, "file must not be null");
        String json = toJson(modules);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, json);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", file, e.getMessage());
            throw new NetlistException(ErrorKind.IO_ERROR, "Failed to write " + file, e);
        }
        log.info("Objects saved to {} ({} modules)", file, modules.size());
    }

    ModuleDocument toDocument(Module module) {
        PortsDocument ports = new PortsDocument(
            module.inputs().stream().map(JsonNetlistCodec::toDocument).toList(),
            module.outputs().stream().map(JsonNetlistCodec::toDocument).toList());

        List<InstanceDocument> instances = new ArrayList<>();
        for (Instance instance : module.instances()) {
            List<PinDocument> pins = instance.pins().stream()
                .map(pin -> new PinDocument(
                    pin.name(),
                    pin.knownDirection().map(Direction::keyword).orElse(null),
                    pin.instanceName(),
                    module.netOf(pin).map(Net::name).orElse(null)))
                .toList();
            instances.add(new InstanceDocument(instance.name(), instance.cellType().tag(), instance.refName(), pins));
        }

        List<NetDocument> nets = module.netList().stream()
            .map(net -> new NetDocument(net.name(), net.type().tag(), widthOf(net.width())))
            .toList();

        return new ModuleDocument(module.name(), ports, instances, nets);
    }

    private static PortDocument toDocument(Port port) {
        return new PortDocument(port.name(), port.direction().keyword(), widthOf(port.width()));
    }

    private static List<Integer> widthOf(BitRange width) {
        return width == null ? null : width.toList();
    }

    // ==================== Reading ====================

    /**
     * Reads modules from a JSON file.
     *
     * @param file JSON exchange file
     * @return modules and reload diagnostics
     * @throws NetlistException with {@link ErrorKind#IO_ERROR} if the file is missing or
     *                          unreadable, {@link ErrorKind#MALFORMED_DOCUMENT} if it is not
     *                          a module array
     */
    public NetlistResult read(Path file) throws NetlistException {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file)) {
            log.error("The file at {} was not found", file);
            throw new NetlistException(ErrorKind.IO_ERROR, "The file at " + file + " was not found");
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            throw new NetlistException(ErrorKind.IO_ERROR, "Failed to read " + file, e);
        }
        NetlistResult result = fromJson(json);
        log.info("Objects loaded from {} ({} modules)", file, result.modules().size());
        return result;
    }

    /**
     * Reads modules from JSON text.
     *
     * @param json JSON array of module records
     * @return modules and reload diagnostics
     * @throws NetlistException with {@link ErrorKind#MALFORMED_DOCUMENT} if the text is not
     *                          a valid module array
     */
    public NetlistResult fromJson(String json) throws NetlistException {
        Objects.requireNonNull(json, "json must not be null");

        List<ModuleDocument> documents;
        try {
            documents = JSON_MAPPER.readValue(json, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Malformed netlist document: {}", e.getOriginalMessage());
            throw new NetlistException(ErrorKind.MALFORMED_DOCUMENT,
                "Not a netlist document: " + e.getOriginalMessage(), e);
        }
        if (documents == null) {
            throw new NetlistException(ErrorKind.MALFORMED_DOCUMENT, "Netlist document is empty");
        }

        List<Module> modules = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ModuleDocument document : documents) {
            if (document == null) {
                throw new NetlistException(ErrorKind.MALFORMED_DOCUMENT, "Null module record");
            }
            try {
                modules.add(fromDocument(document, diagnostics));
            } catch (IllegalArgumentException e) {
                throw new NetlistException(ErrorKind.MALFORMED_DOCUMENT,
                    "Invalid module record '" + document.moduleName() + "': " + e.getMessage(), e);
            }
        }
        return new NetlistResult(modules, diagnostics);
    }

    private Module fromDocument(ModuleDocument document, List<Diagnostic> diagnostics) {
        ModuleBuilder builder = new ModuleBuilder(required(document.moduleName(), "module_name"));

        for (PortDocument port : document.ports().input()) {
            builder.addPort(required(port.name(), "port name"), Direction.INPUT, BitRange.fromList(port.width()));
        }
        for (PortDocument port : document.ports().output()) {
            builder.addPort(required(port.name(), "port name"), Direction.OUTPUT, BitRange.fromList(port.width()));
        }

        Map<String, NetRef> netsByName = new HashMap<>();
        for (NetDocument net : document.nets()) {
            String netName = required(net.name(), "net name");
            NetRef ref = builder.addNet(new Net(netName, classify(netName), BitRange.fromList(net.width())));
            netsByName.put(netName, ref);
        }

        for (InstanceDocument instance : document.instances()) {
            CellType cellType = instance.cellType() != null
                ? CellType.fromTag(instance.cellType())
                : CellType.LEAF_LEVEL;
            InstanceBuilder instanceBuilder = builder.openInstance(
                required(instance.instance(), "instance"), required(instance.refName(), "ref_name"), cellType);
            for (PinDocument pin : instance.pins()) {
                Direction direction = pin.direction() != null ? Direction.fromKeyword(pin.direction()) : null;
                NetRef ref = resolvePin(builder, netsByName, pin.net());
                if (ref == null) {
                    String message = "No net found for pin " + pin.name() + " of instance " + instance.instance()
                        + (pin.net() != null ? " connected to '" + pin.net() + "'" : "");
                    diagnostics.add(
                        new Diagnostic(DiagnosticKind.UNRESOLVED_REFERENCE, document.moduleName(), message, 0));
                    log.warn(message);
                }
                instanceBuilder.addPin(required(pin.name(), "pin name"), direction, ref);
            }
        }
        return builder.build();
    }

    private static NetRef resolvePin(ModuleBuilder builder, Map<String, NetRef> netsByName, String netName) {
        if (netName == null) {
            return null;
        }
        if (NetlistPatterns.isConstant(netName)) {
            return builder.allocate(new Net(netName, NetType.CONSTANT, null));
        }
        if (netName.contains("[")) {
            return builder.allocate(new Net(netName, NetType.WIRE_SUB, null));
        }
        return netsByName.get(netName);
    }

    private static String required(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    private static NetType classify(String netName) {
        if (NetlistPatterns.isConstant(netName)) {
            return NetType.CONSTANT;
        }
        if (netName.contains("[")) {
            return NetType.WIRE_SUB;
        }
        return NetType.WIRE;
    }
}
