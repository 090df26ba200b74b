package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * {@code <RadioInfo>}: periodic radio state, and on every change of frequency,
 * mode or transmit state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "RadioInfo")
public class RadioInfo implements N1mmMessage {

    @JacksonXmlProperty(localName = "app")
    private String app;

    @JacksonXmlProperty(localName = "StationName")
    private String stationName;

    @JacksonXmlProperty(localName = "RadioNr")
    private int radioNr;

    @JacksonXmlProperty(localName = "Freq")
    private long frequency;

    @JacksonXmlProperty(localName = "TXFreq")
    private long txFrequency;

    @JacksonXmlProperty(localName = "Mode")
    private String mode;

    @JacksonXmlProperty(localName = "OpCall")
    private String opCall;

    @JacksonXmlProperty(localName = "IsRunning")
    private boolean running;

    @JacksonXmlProperty(localName = "FocusEntry")
    private int focusEntry;

    @JacksonXmlProperty(localName = "EntryWindowHwnd")
    private int entryWindowHwnd;

    @JacksonXmlProperty(localName = "Antenna")
    private int antenna;

    @JacksonXmlProperty(localName = "Rotors")
    private String rotors;

    @JacksonXmlProperty(localName = "FocusRadioNr")
    private int focusRadioNr;

    @JacksonXmlProperty(localName = "IsStereo")
    private boolean stereo;

    @JacksonXmlProperty(localName = "IsSplit")
    private boolean split;

    @JacksonXmlProperty(localName = "ActiveRadioNr")
    private int activeRadioNr;

    @JacksonXmlProperty(localName = "IsTransmitting")
    private boolean transmitting;

    @JacksonXmlProperty(localName = "FunctionKeyCaption")
    private String functionKeyCaption;

    @JacksonXmlProperty(localName = "RadioName")
    private String radioName;

    @JacksonXmlProperty(localName = "AuxAntSelected")
    private int auxAntSelected = -1;

    @JacksonXmlProperty(localName = "AuxAntSelectedName")
    private String auxAntSelectedName;

    @JacksonXmlProperty(localName = "IsConnected")
    private boolean connected;

    public String getApp() { return app; }
    public void setApp(String app) { this.app = app; }

    public String getStationName() { return stationName; }
    public void setStationName(String stationName) { this.stationName = stationName; }

    public int getRadioNr() { return radioNr; }
    public void setRadioNr(int radioNr) { this.radioNr = radioNr; }

    public long getFrequency() { return frequency; }
    public void setFrequency(long frequency) { this.frequency = frequency; }

    public long getTxFrequency() { return txFrequency; }
    public void setTxFrequency(long txFrequency) { this.txFrequency = txFrequency; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getOpCall() { return opCall; }
    public void setOpCall(String opCall) { this.opCall = opCall; }

    public boolean isRunning() { return running; }
    public void setRunning(boolean running) { this.running = running; }

    public int getFocusEntry() { return focusEntry; }
    public void setFocusEntry(int focusEntry) { this.focusEntry = focusEntry; }

    public int getEntryWindowHwnd() { return entryWindowHwnd; }
    public void setEntryWindowHwnd(int entryWindowHwnd) { this.entryWindowHwnd = entryWindowHwnd; }

    public int getAntenna() { return antenna; }
    public void setAntenna(int antenna) { this.antenna = antenna; }

    public String getRotors() { return rotors; }
    public void setRotors(String rotors) { this.rotors = rotors; }

    public int getFocusRadioNr() { return focusRadioNr; }
    public void setFocusRadioNr(int focusRadioNr) { this.focusRadioNr = focusRadioNr; }

    public boolean isStereo() { return stereo; }
    public void setStereo(boolean stereo) { this.stereo = stereo; }

    public boolean isSplit() { return split; }
    public void setSplit(boolean split) { this.split = split; }

    public int getActiveRadioNr() { return activeRadioNr; }
    public void setActiveRadioNr(int activeRadioNr) { this.activeRadioNr = activeRadioNr; }

    public boolean isTransmitting() { return transmitting; }
    public void setTransmitting(boolean transmitting) { this.transmitting = transmitting; }

    public String getFunctionKeyCaption() { return functionKeyCaption; }
    public void setFunctionKeyCaption(String functionKeyCaption) { this.functionKeyCaption = functionKeyCaption; }

    public String getRadioName() { return radioName; }
    public void setRadioName(String radioName) { this.radioName = radioName; }

    public int getAuxAntSelected() { return auxAntSelected; }
    public void setAuxAntSelected(int auxAntSelected) { this.auxAntSelected = auxAntSelected; }

    public String getAuxAntSelectedName() { return auxAntSelectedName; }
    public void setAuxAntSelectedName(String auxAntSelectedName) { this.auxAntSelectedName = auxAntSelectedName; }

    public boolean isConnected() { return connected; }
    public void setConnected(boolean connected) { this.connected = connected; }

    @Override
    public String toString() {
        return "RadioInfo{" +
            "stationName='" + stationName + '\'' +
            ", radioNr=" + radioNr +
            ", frequency=" + frequency +
            ", mode='" + mode + '\'' +
            ", transmitting=" + transmitting +
            ", connected=" + connected +
            '}';
    }
}
