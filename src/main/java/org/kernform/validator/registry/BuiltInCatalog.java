package org.kernform.validator.registry;

import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.KernelContract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.kernform.validator.model.AccessMode.INC;
import static org.kernform.validator.model.AccessMode.READ;
import static org.kernform.validator.model.AccessMode.READWRITE;
import static org.kernform.validator.model.AccessMode.SUM;
import static org.kernform.validator.model.AccessMode.WRITE;
import static org.kernform.validator.model.DataType.INTEGER;
import static org.kernform.validator.model.DataType.REAL;

/**
 * The standard library built-ins. Their bodies are generated, so only their contracts live here.
 * <p>
 * Every entry satisfies the built-in shape rules; the catalog is immutable and shared.
 */
public final class BuiltInCatalog {

    private static final String SPACE = "any_space_1";
    private static final String OTHER_SPACE = "any_space_2";

    private static final List<KernelContract> STANDARD = Collections.unmodifiableList(createStandard());

    private BuiltInCatalog() {}

    /**
     * Returns all standard built-ins.
     * @return An unmodifiable list in catalog order.
     */
    public static List<KernelContract> standard() {
        return STANDARD;
    }

    private static List<KernelContract> createStandard() {
        List<KernelContract> builtIns = new ArrayList<>();

        // Setting
        builtIns.add(KernelContract.builtIn("setval_c")
                .field(REAL, WRITE, SPACE).scalar(REAL, READ).build());
        builtIns.add(KernelContract.builtIn("setval_X")
                .field(REAL, WRITE, SPACE).field(REAL, READ, SPACE).build());

        // Addition and subtraction
        builtIns.add(KernelContract.builtIn("X_plus_Y")
                .field(REAL, WRITE, SPACE).field(REAL, READ, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("inc_X_plus_Y")
                .field(REAL, READWRITE, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("aX_plus_Y")
                .field(REAL, WRITE, SPACE).scalar(REAL, READ).field(REAL, READ, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("inc_aX_plus_Y")
                .scalar(REAL, READ).field(REAL, READWRITE, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("X_minus_Y")
                .field(REAL, WRITE, SPACE).field(REAL, READ, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("inc_X_minus_Y")
                .field(REAL, READWRITE, SPACE).field(REAL, READ, SPACE).build());

        // Multiplication and division
        builtIns.add(KernelContract.builtIn("X_times_Y")
                .field(REAL, WRITE, SPACE).field(REAL, READ, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("inc_X_times_Y")
                .field(REAL, READWRITE, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("a_times_X")
                .field(REAL, WRITE, SPACE).scalar(REAL, READ).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("inc_a_times_X")
                .scalar(REAL, READ).field(REAL, READWRITE, SPACE).build());
        builtIns.add(KernelContract.builtIn("X_divideby_Y")
                .field(REAL, WRITE, SPACE).field(REAL, READ, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("inc_X_divideby_Y")
                .field(REAL, READWRITE, SPACE).field(REAL, READ, SPACE).build());

        // Increment-style accumulation
        builtIns.add(KernelContract.builtIn("inc_X_plus_bY")
                .field(REAL, INC, SPACE).scalar(REAL, READ).field(REAL, READ, SPACE).build());

        // Reductions
        builtIns.add(KernelContract.builtIn("X_innerproduct_Y").tag(BuiltInTag.PURE_REDUCTION)
                .scalar(REAL, SUM).field(REAL, READ, SPACE).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("X_innerproduct_X").tag(BuiltInTag.PURE_REDUCTION)
                .scalar(REAL, SUM).field(REAL, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("sum_X").tag(BuiltInTag.PURE_REDUCTION)
                .scalar(REAL, SUM).field(REAL, READ, SPACE).build());

        // Integer variants
        builtIns.add(KernelContract.builtIn("int_setval_c")
                .field(INTEGER, WRITE, SPACE).scalar(INTEGER, READ).build());
        builtIns.add(KernelContract.builtIn("int_setval_X")
                .field(INTEGER, WRITE, SPACE).field(INTEGER, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("int_X_plus_Y")
                .field(INTEGER, WRITE, SPACE).field(INTEGER, READ, SPACE).field(INTEGER, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("int_inc_X_plus_Y")
                .field(INTEGER, READWRITE, SPACE).field(INTEGER, READ, SPACE).build());
        builtIns.add(KernelContract.builtIn("int_a_times_X")
                .field(INTEGER, WRITE, SPACE).scalar(INTEGER, READ).field(INTEGER, READ, SPACE).build());

        // Conversions
        builtIns.add(KernelContract.builtIn("int_X").tag(BuiltInTag.CROSS_SPACE_CONVERSION)
                .field(INTEGER, WRITE, SPACE).field(REAL, READ, OTHER_SPACE).build());
        builtIns.add(KernelContract.builtIn("real_X").tag(BuiltInTag.CROSS_SPACE_CONVERSION)
                .field(REAL, WRITE, SPACE).field(INTEGER, READ, OTHER_SPACE).build());

        return builtIns;
    }
}
