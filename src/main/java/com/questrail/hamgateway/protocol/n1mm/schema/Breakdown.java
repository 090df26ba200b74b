package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Per band and mode totals of a {@link DynamicResults} message. The
 * {@code <qso>} and {@code <point>} elements repeat directly inside
 * {@code <breakdown>} without wrapper elements.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Breakdown {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "qso")
    private List<QsoBreakdown> qsos = new ArrayList<>();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "point")
    private List<PointBreakdown> points = new ArrayList<>();

    public List<QsoBreakdown> getQsos() { return qsos; }
    public void setQsos(List<QsoBreakdown> qsos) { this.qsos = qsos; }

    public List<PointBreakdown> getPoints() { return points; }
    public void setPoints(List<PointBreakdown> points) { this.points = points; }
}
