package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/**
 * {@code <qth>} element of {@link DynamicResults}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Location {

    @JacksonXmlProperty(localName = "dxcccountry")
    private String dxccCountry;

    @JacksonXmlProperty(localName = "cqzone")
    private int cqZone;

    @JacksonXmlProperty(localName = "iaruzone")
    private int iaruZone;

    @JacksonXmlProperty(localName = "arrlsection")
    private String arrlSection;

    @JacksonXmlProperty(localName = "stprvoth")
    private String stateProvinceOther;

    @JacksonXmlProperty(localName = "grid6")
    private String grid6;

    public String getDxccCountry() { return dxccCountry; }
    public void setDxccCountry(String dxccCountry) { this.dxccCountry = dxccCountry; }

    public int getCqZone() { return cqZone; }
    public void setCqZone(int cqZone) { this.cqZone = cqZone; }

    public int getIaruZone() { return iaruZone; }
    public void setIaruZone(int iaruZone) { this.iaruZone = iaruZone; }

    public String getArrlSection() { return arrlSection; }
    public void setArrlSection(String arrlSection) { this.arrlSection = arrlSection; }

    public String getStateProvinceOther() { return stateProvinceOther; }
    public void setStateProvinceOther(String stateProvinceOther) { this.stateProvinceOther = stateProvinceOther; }

    public String getGrid6() { return grid6; }
    public void setGrid6(String grid6) { this.grid6 = grid6; }

    @Override
    public String toString() {
        return "Location{" +
            "dxccCountry='" + dxccCountry + '\'' +
            ", cqZone=" + cqZone +
            ", grid6='" + grid6 + '\'' +
            '}';
    }
}
