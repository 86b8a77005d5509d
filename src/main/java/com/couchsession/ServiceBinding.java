package com.couchsession;

import com.couchsession.error.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.util.Map;

/**
 * Database credentials bound to a Cloud Foundry application, read from {@code VCAP_SERVICES}.
 */
public final class ServiceBinding {

    static final String SERVICE_LABEL = "cloudantNoSQLDB";
    private static final int DEFAULT_PORT = 443;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final String host;
    private final int port;
    private final String username;
    private final String password;

    private ServiceBinding(String name, String host, int port, String username, String password) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
    }

    /**
     * @param vcapServices JSON text, a {@link JsonNode} or a {@link Map} in the VCAP_SERVICES layout
     * @param name         service instance name; null picks the only bound instance
     * @throws ConfigurationException when no single instance matches or the structure is broken
     */
    public static ServiceBinding parse(Object vcapServices, String name) {
        JsonNode services = toTree(vcapServices);
        if (services == null || !services.isObject()) {
            throw new ConfigurationException("Failed to decode VCAP_SERVICES service credentials");
        }
        JsonNode instances = services.path(SERVICE_LABEL);
        if (!instances.isMissingNode() && !instances.isArray()) {
            throw new ConfigurationException("Failed to decode VCAP_SERVICES service credentials");
        }

        boolean useFirst = name == null && instances.size() == 1;
        for (JsonNode service : instances) {
            if (!service.isObject()) {
                throw new ConfigurationException("Failed to decode VCAP_SERVICES service credentials");
            }
            String serviceName = service.hasNonNull("name") ? service.get("name").asText() : null;
            if (useFirst || (name != null && name.equals(serviceName))) {
                JsonNode credentials = required(service, "credentials");
                if (!credentials.isObject()) {
                    throw new ConfigurationException("Failed to decode VCAP_SERVICES service credentials");
                }
                String host = required(credentials, "host").asText();
                String password = required(credentials, "password").asText();
                String username = required(credentials, "username").asText();
                int port = credentials.hasNonNull("port") ? parsePort(credentials.get("port")) : DEFAULT_PORT;
                return new ServiceBinding(serviceName, host, port, username, password);
            }
        }
        throw new ConfigurationException("Missing service in VCAP_SERVICES");
    }

    private static JsonNode toTree(Object vcapServices) {
        if (vcapServices instanceof JsonNode node) {
            return node;
        }
        if (vcapServices instanceof Map<?, ?> map) {
            try {
                return MAPPER.valueToTree(map);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Failed to decode VCAP_SERVICES service credentials", e);
            }
        }
        if (vcapServices instanceof String json) {
            try {
                return MAPPER.readTree(json);
            } catch (JsonProcessingException e) {
                throw new ConfigurationException("Failed to decode VCAP_SERVICES JSON", e);
            }
        }
        return null;
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigurationException("Invalid service: '" + field + "' missing");
        }
        return value;
    }

    private static int parsePort(JsonNode node) {
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Failed to decode VCAP_SERVICES service credentials", e);
        }
    }

    public String name() {
        return name;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public URI url() {
        return URI.create("https://" + host + ":" + port);
    }
}
