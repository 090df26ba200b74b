package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.questrail.hamgateway.protocol.n1mm.N1mmDecimalDeserializer;
import com.questrail.hamgateway.protocol.n1mm.N1mmTimestampDeserializer;

import java.time.LocalDateTime;

/**
 * {@code <spot>}: a DX cluster spot was received or its status changed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "spot")
public class Spot implements N1mmMessage {

    @JacksonXmlProperty(localName = "app")
    private String app;

    @JacksonXmlProperty(localName = "StationName")
    private String stationName;

    @JacksonXmlProperty(localName = "dxcall")
    private String dxCall;

    @JsonDeserialize(using = N1mmDecimalDeserializer.class)
    @JacksonXmlProperty(localName = "frequency")
    private double frequency;

    @JacksonXmlProperty(localName = "spottercall")
    private String spotterCall;

    @JsonDeserialize(using = N1mmTimestampDeserializer.class)
    @JacksonXmlProperty(localName = "timestamp")
    private LocalDateTime timestamp;

    @JacksonXmlProperty(localName = "action")
    private String action;

    @JacksonXmlProperty(localName = "mode")
    private String mode;

    @JacksonXmlProperty(localName = "comment")
    private String comment;

    @JacksonXmlProperty(localName = "status")
    private String status;

    @JacksonXmlProperty(localName = "statuslist")
    private String statusList;

    public String getApp() { return app; }
    public void setApp(String app) { this.app = app; }

    public String getStationName() { return stationName; }
    public void setStationName(String stationName) { this.stationName = stationName; }

    public String getDxCall() { return dxCall; }
    public void setDxCall(String dxCall) { this.dxCall = dxCall; }

    public double getFrequency() { return frequency; }
    public void setFrequency(double frequency) { this.frequency = frequency; }

    public String getSpotterCall() { return spotterCall; }
    public void setSpotterCall(String spotterCall) { this.spotterCall = spotterCall; }

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getComment() { return comment; }
    public void setComment(String comment) { this.comment = comment; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getStatusList() { return statusList; }
    public void setStatusList(String statusList) { this.statusList = statusList; }

    @Override
    public String toString() {
        return "Spot{" +
            "dxCall='" + dxCall + '\'' +
            ", frequency=" + frequency +
            ", mode='" + mode + '\'' +
            ", spotterCall='" + spotterCall + '\'' +
            ", action='" + action + '\'' +
            ", timestamp=" + timestamp +
            '}';
    }
}
