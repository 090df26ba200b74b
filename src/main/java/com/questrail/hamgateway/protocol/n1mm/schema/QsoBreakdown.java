package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

/**
 * One {@code <qso>} line of a {@link Breakdown}: the qso count for a band and
 * mode ({@code ALL} for totals).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QsoBreakdown {

    @JacksonXmlProperty(isAttribute = true, localName = "band")
    private String band;

    @JacksonXmlProperty(isAttribute = true, localName = "mode")
    private String mode;

    @JacksonXmlText
    private int count;

    public String getBand() { return band; }
    public void setBand(String band) { this.band = band; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public int getCount() { return count; }
    public void setCount(int count) { this.count = count; }

    @Override
    public String toString() {
        return band + "/" + mode + "=" + count;
    }
}
