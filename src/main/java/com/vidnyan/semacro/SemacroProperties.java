package com.vidnyan.semacro;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for policy loading and queries.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "semacro")
public class SemacroProperties {

    /**
     * Explicit include root(s), separated by the platform path separator.
     * Overrides the environment variable and the defaults.
     */
    private String includePath;

    /**
     * Environment variable consulted when no explicit include path is given.
     */
    private String includePathEnv = "SEMACRO_INCLUDE_PATH";

    /**
     * Fallback include roots, used only when they contain policy files.
     */
    private List<String> defaultIncludePaths = new ArrayList<>();

    /**
     * Suffixes of files holding interface and template definitions.
     */
    private List<String> interfaceSuffixes = new ArrayList<>();

    /**
     * Suffixes of files holding define literals.
     */
    private List<String> defineSuffixes = new ArrayList<>();

    private int defaultDepth = 10;

    /**
     * Expansion depth used by rule search.
     */
    private int whichDepth = 5;

    /**
     * Maximum "did you mean" suggestions for an unknown name.
     */
    private int suggestionLimit = 5;

    @PostConstruct
    public void init() {
        if (defaultIncludePaths.isEmpty()) {
            defaultIncludePaths.add("/usr/share/selinux/devel/include");
        }
        if (interfaceSuffixes.isEmpty()) {
            interfaceSuffixes.add(".if");
        }
        if (defineSuffixes.isEmpty()) {
            defineSuffixes.add(".spt");
        }
    }
}
