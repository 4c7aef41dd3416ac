package org.dxworks.fortframe.correlate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.fortframe.diagnostics.ConfigurationException;
import org.dxworks.fortframe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializable directory of a documented project's modules and their public members with the URLs
 * of their pages. Read from another project to resolve names that escape this one, or produced from
 * this project for others to link against.
 */
public class ExternalLinkDirectory {
    private static final Logger logger = LoggerFactory.getLogger(ExternalLinkDirectory.class);

    public static final String FILE_NAME = "modules.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final List<ModuleLink> modules;

    public ExternalLinkDirectory(List<ModuleLink> modules) {
        this.modules = modules;
    }

    public List<ModuleLink> getModules() {
        return modules;
    }

    /**
     * Reads {@value #FILE_NAME} from a directory or an http(s) base URL.
     *
     * @throws ConfigurationException if the directory cannot be read or parsed
     */
    public static ExternalLinkDirectory read(String location) {
        String json;
        try {
            if (location.startsWith("http://") || location.startsWith("https://")) {
                json = fetch(location.endsWith("/") ? location + FILE_NAME : location + "/" + FILE_NAME);
            } else {
                json = Files.readString(Path.of(location).resolve(FILE_NAME), StandardCharsets.UTF_8);
            }
            List<ModuleLink> modules = MAPPER.readValue(json, new TypeReference<List<ModuleLink>>() {});
            logger.debug("Read {} external modules from {}", modules.size(), location);
            return new ExternalLinkDirectory(modules);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read external project at " + location + ": " + e.getMessage(), e);
        }
    }

    private static String fetch(String url) throws IOException {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(TIMEOUT).GET().build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new IOException("HTTP " + response.statusCode() + " for " + url);
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + url, e);
        }
    }

    /** Link directory of the non-submodule modules of the given files, with pages under {@code baseUrl}. */
    public static ExternalLinkDirectory of(List<SourceFileEntity> files, String baseUrl) {
        List<ModuleLink> modules = new ArrayList<>();
        for (SourceFileEntity file : files) {
            for (ModuleEntity module : file.childrenOf(ModuleEntity.class)) {
                if (module.isSubmodule()) {
                    continue;
                }
                ModuleLink link = new ModuleLink();
                link.name = module.name;
                link.url = EntityUrls.urlFor(module, baseUrl);
                for (FortranEntity member : ScopeResolver.declaredMembers(module)) {
                    if (!member.permission.isExported() || member.name == null || member.name.isEmpty()) {
                        continue;
                    }
                    MemberLink memberLink = new MemberLink();
                    memberLink.name = member.name;
                    memberLink.kind = member.kind;
                    memberLink.url = EntityUrls.urlFor(member, baseUrl);
                    if (member instanceof ProcedureEntity procedure) {
                        memberLink.procedureType = procedure.procedureType;
                    }
                    link.members.add(memberLink);
                }
                modules.add(link);
            }
        }
        return new ExternalLinkDirectory(modules);
    }

    public void write(Path directory) throws IOException {
        Files.createDirectories(directory);
        Files.writeString(directory.resolve(FILE_NAME), MAPPER.writeValueAsString(modules), StandardCharsets.UTF_8);
    }

    /** Placeholder modules whose public members carry the external page URLs. */
    public List<ModuleEntity> toModules() {
        List<ModuleEntity> placeholders = new ArrayList<>();
        for (ModuleLink link : modules) {
            ModuleEntity module = new ModuleEntity(link.name);
            module.externalUrl = link.url;
            for (MemberLink memberLink : link.members) {
                FortranEntity member = placeholder(memberLink);
                if (member == null) {
                    logger.debug("Skipping external member {} of unsupported kind {}", memberLink.name, memberLink.kind);
                    continue;
                }
                member.externalUrl = memberLink.url;
                module.addChild(member);
                module.publicNames.add(Scope.key(member.name));
            }
            placeholders.add(module);
        }
        return placeholders;
    }

    private static FortranEntity placeholder(MemberLink link) {
        if (link.kind == null || link.name == null) {
            return null;
        }
        return switch (link.kind) {
            case PROCEDURE -> new ProcedureEntity(link.name,
                    link.procedureType != null ? link.procedureType : ProcedureType.SUBROUTINE);
            case INTERFACE -> new InterfaceEntity(link.name, InterfaceType.GENERIC);
            case ABSTRACT_INTERFACE -> new InterfaceEntity(link.name, InterfaceType.ABSTRACT);
            case DERIVED_TYPE -> new DerivedTypeEntity(link.name);
            case VARIABLE -> new VariableEntity(link.name);
            case COMMON_BLOCK -> new CommonBlockEntity(link.name);
            case NAMELIST -> new NamelistEntity(link.name);
            default -> null;
        };
    }

    public static class ModuleLink {
        public String name;
        public String url;
        public List<MemberLink> members = new ArrayList<>();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MemberLink {
        public String name;
        public EntityKind kind;
        public String url;
        public ProcedureType procedureType;
    }
}
