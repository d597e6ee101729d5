package com.deerbot.server.ai.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class NodeRecord {
    public List<String> links = new ArrayList<>();
    public List<Integer> freqs = new ArrayList<>();
    public int weight;
    @JsonProperty("isExit")
    public boolean isExit;

    public NodeRecord() {
    }

    public NodeRecord(List<String> links, List<Integer> freqs, int weight, boolean isExit) {
        this.links = links;
        this.freqs = freqs;
        this.weight = weight;
        this.isExit = isExit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeRecord))
            return false;
        NodeRecord other = (NodeRecord) o;
        return weight == other.weight
                && isExit == other.isExit
                && Objects.equals(links, other.links)
                && Objects.equals(freqs, other.freqs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(links, freqs, weight, isExit);
    }

    @Override
    public String toString() {
        return "NodeRecord{links=" + links + ", freqs=" + freqs + ", weight=" + weight + ", isExit=" + isExit + "}";
    }
}
