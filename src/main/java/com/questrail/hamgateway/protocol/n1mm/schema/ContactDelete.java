package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.questrail.hamgateway.protocol.n1mm.N1mmTimestampDeserializer;

import java.time.LocalDateTime;

/**
 * {@code <contactdelete>}: a QSO was deleted from the log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "contactdelete")
public class ContactDelete implements N1mmMessage {

    @JacksonXmlProperty(localName = "app")
    private String app;

    @JsonDeserialize(using = N1mmTimestampDeserializer.class)
    @JacksonXmlProperty(localName = "timestamp")
    private LocalDateTime timestamp;

    @JacksonXmlProperty(localName = "call")
    private String call;

    @JacksonXmlProperty(localName = "contestnr")
    private int contestNr;

    @JacksonXmlProperty(localName = "StationName")
    private String stationName;

    @JacksonXmlProperty(localName = "ID")
    private String id;

    public String getApp() { return app; }
    public void setApp(String app) { this.app = app; }

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    public String getCall() { return call; }
    public void setCall(String call) { this.call = call; }

    public int getContestNr() { return contestNr; }
    public void setContestNr(int contestNr) { this.contestNr = contestNr; }

    public String getStationName() { return stationName; }
    public void setStationName(String stationName) { this.stationName = stationName; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    @Override
    public String toString() {
        return "ContactDelete{" +
            "call='" + call + '\'' +
            ", timestamp=" + timestamp +
            ", contestNr=" + contestNr +
            ", stationName='" + stationName + '\'' +
            ", id='" + id + '\'' +
            '}';
    }
}
