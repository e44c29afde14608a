package com.musicinsights.librarysync.infrastructure.remote.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * export의 아티스트 항목. {@code artists.ndjson}의 한 줄이거나 트랙/앨범 안의 참조다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportArtistLine {

    /** 원격 아티스트 id */
    @JsonProperty("id")
    public String id;

    /** 아티스트 이름 */
    @JsonProperty("name")
    public String name;
}
