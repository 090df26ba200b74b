package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/**
 * Entry category of a {@link DynamicResults} message, carried as attributes of
 * its {@code <class>} element.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContestClass {

    @JacksonXmlProperty(isAttribute = true, localName = "power")
    private String power;

    @JacksonXmlProperty(isAttribute = true, localName = "assisted")
    private String assisted;

    @JacksonXmlProperty(isAttribute = true, localName = "transmitter")
    private String transmitter;

    @JacksonXmlProperty(isAttribute = true, localName = "ops")
    private String ops;

    @JacksonXmlProperty(isAttribute = true, localName = "bands")
    private String bands;

    @JacksonXmlProperty(isAttribute = true, localName = "mode")
    private String mode;

    @JacksonXmlProperty(isAttribute = true, localName = "overlay")
    private String overlay;

    public String getPower() { return power; }
    public void setPower(String power) { this.power = power; }

    public String getAssisted() { return assisted; }
    public void setAssisted(String assisted) { this.assisted = assisted; }

    public String getTransmitter() { return transmitter; }
    public void setTransmitter(String transmitter) { this.transmitter = transmitter; }

    public String getOps() { return ops; }
    public void setOps(String ops) { this.ops = ops; }

    public String getBands() { return bands; }
    public void setBands(String bands) { this.bands = bands; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getOverlay() { return overlay; }
    public void setOverlay(String overlay) { this.overlay = overlay; }
}
