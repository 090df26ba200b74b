package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * {@code <AppInfo>}: sent when N1MM starts, opens a database or loads a contest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "AppInfo")
public class AppInfo implements N1mmMessage {

    @JacksonXmlProperty(localName = "app")
    private String app;

    @JacksonXmlProperty(localName = "dbname")
    private String dbName;

    @JacksonXmlProperty(localName = "contestnr")
    private int contestNr;

    @JacksonXmlProperty(localName = "contestname")
    private String contestName;

    @JacksonXmlProperty(localName = "StationName")
    private String stationName;

    public String getApp() { return app; }
    public void setApp(String app) { this.app = app; }

    public String getDbName() { return dbName; }
    public void setDbName(String dbName) { this.dbName = dbName; }

    public int getContestNr() { return contestNr; }
    public void setContestNr(int contestNr) { this.contestNr = contestNr; }

    public String getContestName() { return contestName; }
    public void setContestName(String contestName) { this.contestName = contestName; }

    public String getStationName() { return stationName; }
    public void setStationName(String stationName) { this.stationName = stationName; }

    @Override
    public String toString() {
        return "AppInfo{" +
            "app='" + app + '\'' +
            ", dbName='" + dbName + '\'' +
            ", contestNr=" + contestNr +
            ", contestName='" + contestName + '\'' +
            ", stationName='" + stationName + '\'' +
            '}';
    }
}
