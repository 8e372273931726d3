package org.kernform.validator.io;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.kernform.validator.api.ValidationException;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.CompilationUnit;
import org.kernform.validator.model.DataType;
import org.kernform.validator.model.Invoke;
import org.kernform.validator.model.InvocationArgument;
import org.kernform.validator.model.IterationDomain;
import org.kernform.validator.model.KernelCall;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.model.AccessMode;
import org.kernform.validator.model.SpaceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a compilation unit (kernel contracts plus invokes) from its JSON form, as written by
 * the metadata extractor and call-site scanner.
 * <p>
 * Input that cannot be represented in the contract model (missing or unknown enum values,
 * kernels without arguments) is rejected with a {@link ValidationException}. Everything that
 * can be represented is read as-is and left to the validator to judge.
 */
public class CompilationUnitReader {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationUnitReader.class);

    private final Gson gson = new Gson();

    /**
     * Reads a unit from a file. The unit is named after the file unless the JSON names it.
     * @param path The JSON file.
     * @return The unit.
     * @throws ValidationException if the file cannot be read or is malformed.
     */
    public CompilationUnit read(Path path) throws ValidationException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.getFileName().toString());
        } catch (IOException e) {
            throw new ValidationException("Could not read compilation unit '" + path + "': " + e.getMessage(), e);
        }
    }

    /**
     * Reads a unit from a JSON string.
     * @param json The JSON text.
     * @param defaultName The unit name if the JSON does not name it.
     * @return The unit.
     * @throws ValidationException if the JSON is malformed.
     */
    public CompilationUnit read(String json, String defaultName) throws ValidationException {
        return read(new StringReader(json), defaultName);
    }

    private CompilationUnit read(Reader reader, String defaultName) throws ValidationException {
        UnitJson unitJson;
        try {
            unitJson = gson.fromJson(reader, UnitJson.class);
        } catch (JsonParseException e) {
            throw new ValidationException("Malformed compilation unit '" + defaultName + "': " + e.getMessage(), e);
        }
        if (unitJson == null) {
            throw new ValidationException("Compilation unit '" + defaultName + "' is empty");
        }

        String name = unitJson.name != null ? unitJson.name : defaultName;
        List<KernelContract> contracts = new ArrayList<>();
        List<KernelJson> kernels = orEmpty(unitJson.kernels);
        for (int i = 0; i < kernels.size(); i++) {
            if (kernels.get(i) == null) {
                throw new ValidationException("Missing kernel " + i + " in compilation unit '" + name + "'");
            }
            contracts.add(toContract(kernels.get(i)));
        }
        List<Invoke> invokes = new ArrayList<>();
        List<InvokeJson> invokeJsons = orEmpty(unitJson.invokes);
        for (int i = 0; i < invokeJsons.size(); i++) {
            if (invokeJsons.get(i) == null) {
                throw new ValidationException("Missing invoke " + i + " in compilation unit '" + name + "'");
            }
            invokes.add(toInvoke(invokeJsons.get(i), i));
        }
        LOG.debug("Read unit '{}' with {} kernel(s) and {} invoke(s)", name, contracts.size(), invokes.size());
        return new CompilationUnit(name, contracts, invokes);
    }

    private KernelContract toContract(KernelJson kernel) throws ValidationException {
        if (kernel.name == null || kernel.name.isBlank()) {
            throw new ValidationException("Kernel without a name");
        }
        String where = "kernel '" + kernel.name + "'";
        if (kernel.arguments == null || kernel.arguments.isEmpty()) {
            throw new ValidationException("The " + where + " declares no arguments");
        }
        List<ArgumentDescriptor> arguments = new ArrayList<>();
        for (int i = 0; i < kernel.arguments.size(); i++) {
            ArgumentJson arg = kernel.arguments.get(i);
            String argWhere = "argument " + i + " of " + where;
            if (arg == null) {
                throw new ValidationException("Missing " + argWhere);
            }
            List<SpaceRef> spaces = new ArrayList<>();
            for (String space : orEmpty(arg.spaces)) {
                if (space == null || space.isBlank()) {
                    throw new ValidationException("Blank space name in " + argWhere);
                }
                spaces.add(SpaceRef.of(space));
            }
            if (spaces.size() > ArgumentDescriptor.MAX_SPACES) {
                throw new ValidationException("The " + argWhere + " declares " + spaces.size()
                        + " spaces; at most " + ArgumentDescriptor.MAX_SPACES + " are allowed");
            }
            arguments.add(new ArgumentDescriptor(
                    required(arg.kind, "kind", argWhere),
                    required(arg.dataType, "dataType", argWhere),
                    required(arg.access, "access", argWhere),
                    spaces));
        }
        Set<BuiltInTag> tags = EnumSet.noneOf(BuiltInTag.class);
        for (BuiltInTag tag : orEmpty(kernel.tags)) {
            tags.add(required(tag, "tags", where));
        }
        return new KernelContract(kernel.name, arguments, required(kernel.operatesOn, "operatesOn", where),
                kernel.builtIn, tags);
    }

    private Invoke toInvoke(InvokeJson invoke, int index) throws ValidationException {
        String name = invoke.name != null ? invoke.name : "invoke_" + index;
        List<KernelCall> calls = new ArrayList<>();
        for (CallJson call : orEmpty(invoke.calls)) {
            if (call == null || call.kernel == null || call.kernel.isBlank()) {
                throw new ValidationException("Call without a kernel name in invoke '" + name + "'");
            }
            String where = "call to '" + call.kernel + "' in invoke '" + name + "'";
            List<InvocationArgument> arguments = new ArrayList<>();
            List<ActualJson> actuals = orEmpty(call.arguments);
            for (int i = 0; i < actuals.size(); i++) {
                ActualJson actual = actuals.get(i);
                if (actual == null || actual.name == null) {
                    throw new ValidationException("Unnamed argument " + i + " in " + where);
                }
                String argWhere = "argument " + i + " of " + where;
                // absent kind or data type means the scanner could not resolve it
                arguments.add(new InvocationArgument(actual.name,
                        optional(actual.kind, ArgumentKind.class, "kind", argWhere),
                        optional(actual.dataType, DataType.class, "dataType", argWhere)));
            }
            calls.add(new KernelCall(call.kernel, arguments));
        }
        return new Invoke(name, calls);
    }

    private static <T> T required(T value, String field, String where) throws ValidationException {
        if (value == null) {
            throw new ValidationException("Missing or unknown '" + field + "' in " + where);
        }
        return value;
    }

    private static <E extends Enum<E>> E optional(String value, Class<E> type, String field, String where)
            throws ValidationException {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Missing or unknown '" + field + "' in " + where, e);
        }
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    // JSON shapes, populated reflectively by Gson

    private static final class UnitJson {
        String name;
        List<KernelJson> kernels;
        List<InvokeJson> invokes;
    }

    private static final class KernelJson {
        String name;
        IterationDomain operatesOn;
        boolean builtIn;
        List<BuiltInTag> tags;
        List<ArgumentJson> arguments;
    }

    private static final class ArgumentJson {
        ArgumentKind kind;
        DataType dataType;
        AccessMode access;
        List<String> spaces;
    }

    private static final class InvokeJson {
        String name;
        List<CallJson> calls;
    }

    private static final class CallJson {
        String kernel;
        List<ActualJson> arguments;
    }

    private static final class ActualJson {
        String name;
        // resolved in toInvoke; absent means unresolved, unknown is an error
        String kind;
        String dataType;
    }
}
