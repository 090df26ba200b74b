package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.questrail.hamgateway.protocol.n1mm.N1mmTimestampDeserializer;

import java.time.LocalDateTime;

/**
 * {@code <dynamicresults>}: score summary published to score reporting sites.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "dynamicresults")
public class DynamicResults implements N1mmMessage {

    @JacksonXmlProperty(localName = "contest")
    private String contest;

    @JacksonXmlProperty(localName = "call")
    private String call;

    @JacksonXmlProperty(localName = "ops")
    private String ops;

    @JacksonXmlProperty(localName = "class")
    private ContestClass contestClass = new ContestClass();

    @JacksonXmlProperty(localName = "club")
    private String club;

    @JacksonXmlProperty(localName = "qth")
    private Location location = new Location();

    @JacksonXmlProperty(localName = "breakdown")
    private Breakdown breakdown = new Breakdown();

    @JacksonXmlProperty(localName = "score")
    private int score;

    @JsonDeserialize(using = N1mmTimestampDeserializer.class)
    @JacksonXmlProperty(localName = "timestamp")
    private LocalDateTime timestamp;

    public String getContest() { return contest; }
    public void setContest(String contest) { this.contest = contest; }

    public String getCall() { return call; }
    public void setCall(String call) { this.call = call; }

    public String getOps() { return ops; }
    public void setOps(String ops) { this.ops = ops; }

    public ContestClass getContestClass() { return contestClass; }
    public void setContestClass(ContestClass contestClass) { this.contestClass = contestClass; }

    public String getClub() { return club; }
    public void setClub(String club) { this.club = club; }

    public Location getLocation() { return location; }
    public void setLocation(Location location) { this.location = location; }

    public Breakdown getBreakdown() { return breakdown; }
    public void setBreakdown(Breakdown breakdown) { this.breakdown = breakdown; }

    public int getScore() { return score; }
    public void setScore(int score) { this.score = score; }

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    @Override
    public String toString() {
        return "DynamicResults{" +
            "contest='" + contest + '\'' +
            ", call='" + call + '\'' +
            ", score=" + score +
            ", timestamp=" + timestamp +
            '}';
    }
}
