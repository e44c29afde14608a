package com.musicinsights.librarysync.infrastructure.remote.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * export의 앨범 항목.
 * <p>
 * {@code albums.ndjson}의 한 줄(저장 앨범, 수록곡 포함)이거나 트랙 안의 앨범 참조(id, name만)다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportAlbumLine {

    /** 원격 앨범 id */
    @JsonProperty("id")
    public String id;

    /** 앨범명 */
    @JsonProperty("name")
    public String name;

    /** 앨범 아티스트 */
    @JsonProperty("artists")
    public List<ExportArtistLine> artists;

    /** 수록곡(저장 앨범일 때) */
    @JsonProperty("tracks")
    public List<ExportTrackLine> tracks;
}
