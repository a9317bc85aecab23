package com.vidnyan.introspect;

import com.vidnyan.introspect.domain.module.VersionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the model engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "introspect")
public class IntrospectProperties {

    /**
     * Module patterns to load: {@code *}, {@code Gtk-*}, {@code Gtk-4.*} or {@code Gtk-4.0}.
     */
    private List<String> modules = new ArrayList<>(List.of("*"));

    /**
     * Package names ({@code Name-Version}) never loaded.
     */
    private List<String> ignore = new ArrayList<>();

    /**
     * Directories searched for {@code <Name>-<Version>.json} element trees.
     */
    private List<String> searchPaths = new ArrayList<>(List.of("girs"));

    private VersionPolicy versionPolicy = VersionPolicy.NONE;

    /**
     * Threads reading and building namespaces. Default: available processors
     */
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Build the model on startup from the properties above.
     */
    private boolean runOnStartup = false;

    private Report report = new Report();

    private Conflicts conflicts = new Conflicts();

    private Patches patches = new Patches();

    @Data
    public static class Report {
        private boolean enabled = true;
        private String output = "introspect-report.json";
    }

    @Data
    public static class Conflicts {
        /**
         * Root class of the object system; reserved methods are forced conflicts below it.
         */
        private String universalBaseType = "GObject.Object";
        private List<String> reservedMethods = new ArrayList<>(List.of("connect", "connect_after", "emit"));
        /**
         * Member names known to be problematic, by namespace name.
         */
        private Map<String, List<String>> known = new LinkedHashMap<>();
    }

    @Data
    public static class Patches {
        /**
         * Inject hand-written generics (Clutter, Meta).
         */
        private boolean inferGenerics = true;
    }
}
