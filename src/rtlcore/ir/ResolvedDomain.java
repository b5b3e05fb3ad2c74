package rtlcore.ir;

import rtlcore.hdl.ClockDomain;

/**
 * A domain reference after lookup.
 * @param name the unique name of the domain in the fragment
 * @param domain the domain declaration
 */
public record ResolvedDomain(String name, ClockDomain domain) {}
