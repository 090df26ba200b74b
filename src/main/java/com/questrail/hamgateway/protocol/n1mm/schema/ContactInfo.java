package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.questrail.hamgateway.protocol.n1mm.N1mmDecimalDeserializer;
import com.questrail.hamgateway.protocol.n1mm.N1mmTimestampDeserializer;

import java.time.LocalDateTime;

/**
 * {@code <contactinfo>}: a QSO was logged.
 *
 * <p>{@link ContactReplace} and {@link LookupInfo} share this shape.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "contactinfo")
public class ContactInfo implements N1mmMessage {

    @JacksonXmlProperty(localName = "app")
    private String app;

    @JacksonXmlProperty(localName = "contestname")
    private String contestName;

    @JacksonXmlProperty(localName = "contestnr")
    private int contestNr;

    @JsonDeserialize(using = N1mmTimestampDeserializer.class)
    @JacksonXmlProperty(localName = "timestamp")
    private LocalDateTime timestamp;

    @JacksonXmlProperty(localName = "mycall")
    private String myCall;

    @JsonDeserialize(using = N1mmDecimalDeserializer.class)
    @JacksonXmlProperty(localName = "band")
    private double band;

    @JacksonXmlProperty(localName = "rxfreq")
    private int rxFreq;

    @JacksonXmlProperty(localName = "txfreq")
    private int txFreq;

    @JacksonXmlProperty(localName = "operator")
    private String operator;

    @JacksonXmlProperty(localName = "mode")
    private String mode;

    @JacksonXmlProperty(localName = "call")
    private String call;

    @JacksonXmlProperty(localName = "countryprefix")
    private String countryPrefix;

    @JacksonXmlProperty(localName = "wpxprefix")
    private String wpxPrefix;

    @JacksonXmlProperty(localName = "stationprefix")
    private String stationPrefix;

    @JacksonXmlProperty(localName = "continent")
    private String continent;

    @JacksonXmlProperty(localName = "snt")
    private String snt;

    @JacksonXmlProperty(localName = "sntnr")
    private int sntNr;

    @JacksonXmlProperty(localName = "rcv")
    private String rcv;

    @JacksonXmlProperty(localName = "rcvnr")
    private int rcvNr;

    @JacksonXmlProperty(localName = "gridsquare")
    private String gridSquare;

    @JsonAlias("exchangel")
    @JacksonXmlProperty(localName = "exchange1")
    private String exchange1;

    @JacksonXmlProperty(localName = "section")
    private String section;

    @JacksonXmlProperty(localName = "comment")
    private String comment;

    @JacksonXmlProperty(localName = "qth")
    private String qth;

    @JacksonXmlProperty(localName = "name")
    private String name;

    @JacksonXmlProperty(localName = "power")
    private String power;

    @JacksonXmlProperty(localName = "misctext")
    private String miscText;

    @JacksonXmlProperty(localName = "zone")
    private int zone;

    @JacksonXmlProperty(localName = "prec")
    private String prec;

    @JacksonXmlProperty(localName = "ck")
    private int ck;

    @JsonAlias("ismultiplierl")
    @JacksonXmlProperty(localName = "ismultiplier1")
    private String multiplier1;

    @JacksonXmlProperty(localName = "ismultiplier2")
    private int multiplier2;

    @JacksonXmlProperty(localName = "ismultiplier3")
    private int multiplier3;

    @JacksonXmlProperty(localName = "points")
    private String points;

    @JacksonXmlProperty(localName = "radionr")
    private String radioNr;

    @JacksonXmlProperty(localName = "run1run2")
    private String run1Run2;

    @JacksonXmlProperty(localName = "RoverLocation")
    private String roverLocation;

    @JacksonXmlProperty(localName = "RadioInterfaced")
    private String radioInterfaced;

    @JacksonXmlProperty(localName = "NetworkedCompNr")
    private int networkedCompNr;

    @JacksonXmlProperty(localName = "IsOriginal")
    private boolean original;

    @JacksonXmlProperty(localName = "NetBiosName")
    private String netBiosName;

    @JacksonXmlProperty(localName = "IsRunQSO")
    private int runQso;

    @JacksonXmlProperty(localName = "StationName")
    private String stationName;

    @JacksonXmlProperty(localName = "ID")
    private String id;

    @JacksonXmlProperty(localName = "IsClaimedQso")
    private int claimedQso;

    public String getApp() { return app; }
    public void setApp(String app) { this.app = app; }

    public String getContestName() { return contestName; }
    public void setContestName(String contestName) { this.contestName = contestName; }

    public int getContestNr() { return contestNr; }
    public void setContestNr(int contestNr) { this.contestNr = contestNr; }

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    public String getMyCall() { return myCall; }
    public void setMyCall(String myCall) { this.myCall = myCall; }

    public double getBand() { return band; }
    public void setBand(double band) { this.band = band; }

    public int getRxFreq() { return rxFreq; }
    public void setRxFreq(int rxFreq) { this.rxFreq = rxFreq; }

    public int getTxFreq() { return txFreq; }
    public void setTxFreq(int txFreq) { this.txFreq = txFreq; }

    public String getOperator() { return operator; }
    public void setOperator(String operator) { this.operator = operator; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getCall() { return call; }
    public void setCall(String call) { this.call = call; }

    public String getCountryPrefix() { return countryPrefix; }
    public void setCountryPrefix(String countryPrefix) { this.countryPrefix = countryPrefix; }

    public String getWpxPrefix() { return wpxPrefix; }
    public void setWpxPrefix(String wpxPrefix) { this.wpxPrefix = wpxPrefix; }

    public String getStationPrefix() { return stationPrefix; }
    public void setStationPrefix(String stationPrefix) { this.stationPrefix = stationPrefix; }

    public String getContinent() { return continent; }
    public void setContinent(String continent) { this.continent = continent; }

    public String getSnt() { return snt; }
    public void setSnt(String snt) { this.snt = snt; }

    public int getSntNr() { return sntNr; }
    public void setSntNr(int sntNr) { this.sntNr = sntNr; }

    public String getRcv() { return rcv; }
    public void setRcv(String rcv) { this.rcv = rcv; }

    public int getRcvNr() { return rcvNr; }
    public void setRcvNr(int rcvNr) { this.rcvNr = rcvNr; }

    public String getGridSquare() { return gridSquare; }
    public void setGridSquare(String gridSquare) { this.gridSquare = gridSquare; }

    public String getExchange1() { return exchange1; }
    public void setExchange1(String exchange1) { this.exchange1 = exchange1; }

    public String getSection() { return section; }
    public void setSection(String section) { this.section = section; }

    public String getComment() { return comment; }
    public void setComment(String comment) { this.comment = comment; }

    public String getQth() { return qth; }
    public void setQth(String qth) { this.qth = qth; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getPower() { return power; }
    public void setPower(String power) { this.power = power; }

    public String getMiscText() { return miscText; }
    public void setMiscText(String miscText) { this.miscText = miscText; }

    public int getZone() { return zone; }
    public void setZone(int zone) { this.zone = zone; }

    public String getPrec() { return prec; }
    public void setPrec(String prec) { this.prec = prec; }

    public int getCk() { return ck; }
    public void setCk(int ck) { this.ck = ck; }

    public String getMultiplier1() { return multiplier1; }
    public void setMultiplier1(String multiplier1) { this.multiplier1 = multiplier1; }

    public int getMultiplier2() { return multiplier2; }
    public void setMultiplier2(int multiplier2) { this.multiplier2 = multiplier2; }

    public int getMultiplier3() { return multiplier3; }
    public void setMultiplier3(int multiplier3) { this.multiplier3 = multiplier3; }

    public String getPoints() { return points; }
    public void setPoints(String points) { this.points = points; }

    public String getRadioNr() { return radioNr; }
    public void setRadioNr(String radioNr) { this.radioNr = radioNr; }

    public String getRun1Run2() { return run1Run2; }
    public void setRun1Run2(String run1Run2) { this.run1Run2 = run1Run2; }

    public String getRoverLocation() { return roverLocation; }
    public void setRoverLocation(String roverLocation) { this.roverLocation = roverLocation; }

    public String getRadioInterfaced() { return radioInterfaced; }
    public void setRadioInterfaced(String radioInterfaced) { this.radioInterfaced = radioInterfaced; }

    public int getNetworkedCompNr() { return networkedCompNr; }
    public void setNetworkedCompNr(int networkedCompNr) { this.networkedCompNr = networkedCompNr; }

    public boolean isOriginal() { return original; }
    public void setOriginal(boolean original) { this.original = original; }

    public String getNetBiosName() { return netBiosName; }
    public void setNetBiosName(String netBiosName) { this.netBiosName = netBiosName; }

    public int getRunQso() { return runQso; }
    public void setRunQso(int runQso) { this.runQso = runQso; }

    public String getStationName() { return stationName; }
    public void setStationName(String stationName) { this.stationName = stationName; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public int getClaimedQso() { return claimedQso; }
    public void setClaimedQso(int claimedQso) { this.claimedQso = claimedQso; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
            "call='" + call + '\'' +
            ", mode='" + mode + '\'' +
            ", band=" + band +
            ", timestamp=" + timestamp +
            ", operator='" + operator + '\'' +
            ", stationName='" + stationName + '\'' +
            ", id='" + id + '\'' +
            '}';
    }
}
