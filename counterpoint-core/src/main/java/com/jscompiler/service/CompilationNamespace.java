package com.jscompiler.service;

import com.jscompiler.vtl.DataSource;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Allocation state shared by every resolver compiled against one target API: the
 * names already handed out and the data source bound to each service.
 *
 * <p>One instance must outlive all compilations for its target, since later
 * compilations have to see earlier allocations. Not thread-safe.</p>
 */
public final class CompilationNamespace {

    private static final Logger LOG = Logger.getLogger(CompilationNamespace.class.getName());

    // key for the data source of resolvers that call nothing
    private static final Object NONE = new Object();

    private final String name;
    private final Map<String, Integer> names = new HashMap<>();
    private final Map<Object, DataSource> dataSources = new HashMap<>();

    public CompilationNamespace(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Allocates {@code base} the first time it is asked for, then {@code base_0},
     * {@code base_1}, and so on.
     */
    public String getUniqueName(String base) {
        Integer counter = names.get(base);
        if (counter == null) {
            names.put(base, 0);
            return base;
        }
        names.put(base, counter + 1);
        return base + "_" + counter;
    }

    /**
     * Returns the data source bound to {@code service}, creating it on first use.
     *
     * @param service the service, or null for the {@code None} data source
     */
    public DataSource getDataSource(Service service, Supplier<DataSource> compute) {
        Object key = service == null ? NONE : service;
        DataSource existing = dataSources.get(key);
        if (existing != null) {
            LOG.fine(() -> "reusing data source " + existing.name() + " in " + name);
            return existing;
        }
        DataSource created = compute.get();
        dataSources.put(key, created);
        LOG.fine(() -> "bound data source " + created.name() + " in " + name);
        return created;
    }

    public int dataSourceCount() {
        return dataSources.size();
    }
}
