package com.phillippitts.strategist.exception;

/**
 * Thrown when a gateway is constructed without a required setting, such as the API key.
 * Fatal: the application refuses to start rather than failing on every call.
 */
public class GatewayConfigurationException extends StrategistException {

    private final String property;

    public GatewayConfigurationException(String property) {
        super("Required gateway setting is missing: " + property);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
