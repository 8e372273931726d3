package org.kernform.validator.model;

import java.util.List;
import java.util.Objects;

/**
 * A single invoke statement grouping one or more kernel calls.
 *
 * @param name A name identifying the invoke within its compilation unit.
 * @param calls The kernel calls in source order.
 */
public record Invoke(String name, List<KernelCall> calls) {

    public Invoke {
        Objects.requireNonNull(name, "name");
        calls = List.copyOf(Objects.requireNonNull(calls, "calls"));
    }
}
