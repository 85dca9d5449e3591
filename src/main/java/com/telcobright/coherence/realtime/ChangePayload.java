package com.telcobright.coherence.realtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Wire shape of a change-feed notification.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangePayload {

    @JsonProperty("eventType")
    public String eventType;

    @JsonProperty("schema")
    public String schema;

    @JsonProperty("table")
    public String table;

    @JsonProperty("commit_timestamp")
    public String commitTimestamp;

    @JsonProperty("new")
    public Map<String, Object> newRecord;   // empty for DELETE

    @JsonProperty("old")
    public Map<String, Object> oldRecord;   // may hold only the primary key
}
