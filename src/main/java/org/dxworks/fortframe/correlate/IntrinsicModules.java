package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.model.ModuleEntity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Modules provided by the compiler or well-known libraries. They have no source in the project and
 * resolve to placeholder modules pointing at their reference documentation.
 */
public final class IntrinsicModules {
    private static final Map<String, String> URLS = new LinkedHashMap<>();

    static {
        URLS.put("iso_fortran_env", "http://fortranwiki.org/fortran/show/iso_fortran_env");
        URLS.put("iso_c_binding", "http://fortranwiki.org/fortran/show/iso_c_binding");
        URLS.put("ieee_arithmetic", "http://fortranwiki.org/fortran/show/ieee_arithmetic");
        URLS.put("ieee_exceptions", "http://fortranwiki.org/fortran/show/IEEE+arithmetic");
        URLS.put("ieee_features", "http://fortranwiki.org/fortran/show/IEEE+arithmetic");
        URLS.put("openacc", "https://www.openacc.org/sites/default/files/inline-images/Specification/OpenACC.3.0.pdf#page=85");
        URLS.put("omp_lib", "https://www.openmp.org/spec-html/5.1/openmpch3.html#x156-1890003");
        URLS.put("mpi", "http://www.mpi-forum.org/docs/mpi-3.1/mpi31-report/node410.htm");
        URLS.put("mpi_f08", "http://www.mpi-forum.org/docs/mpi-3.1/mpi31-report/node409.htm");
    }

    private IntrinsicModules() {
        // utility class
    }

    /** Placeholders for the intrinsic modules, keyed by lower-cased name. */
    public static Map<String, ModuleEntity> intrinsic() {
        return placeholders(URLS);
    }

    /** Placeholders for {@code module name -> documentation URL} pairs, keyed by lower-cased name. */
    public static Map<String, ModuleEntity> placeholders(Map<String, String> urls) {
        Map<String, ModuleEntity> modules = new LinkedHashMap<>();
        urls.forEach((name, url) -> {
            ModuleEntity module = new ModuleEntity(name);
            module.externalUrl = url;
            modules.put(name.toLowerCase(Locale.ROOT), module);
        });
        return modules;
    }
}
