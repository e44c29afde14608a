package com.musicinsights.librarysync.application.sync.remote;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 원격 음악 카탈로그에 대한 추상 인터페이스.
 * <p>
 * 인증/전송 방식은 구현체의 책임이다. 읽기 연산은 Fetching 단계에서만,
 * 쓰기 연산({@link #createPlaylist}, {@link #addTracksToPlaylist})은 미러 플레이리스트 빌더에서만 호출된다.
 * 실패는 {@link RemoteCatalogException}으로 알린다.
 */
public interface RemoteCatalog {

    /** 사용자 플레이리스트 헤더 목록 */
    Flux<PlaylistSnapshot> fetchPlaylists();

    /**
     * 플레이리스트의 트랙을 원격 순서대로 반환한다.
     *
     * @param remoteId 원격 플레이리스트 id
     * @return 트랙 레코드 스트림
     */
    Flux<TrackRecord> fetchPlaylistTracks(String remoteId);

    /** 저장한 앨범(수록곡 포함) */
    Flux<AlbumSnapshot> fetchAlbums();

    /** 저장(구독)한 아티스트 */
    Flux<ArtistRef> fetchArtists();

    /**
     * 원격 플레이리스트를 만든다.
     *
     * @param title 제목
     * @return 생성된 플레이리스트의 원격 id
     */
    Mono<String> createPlaylist(String title);

    /**
     * 원격 플레이리스트 끝에 트랙들을 추가한다.
     *
     * @param remoteId    원격 플레이리스트 id
     * @param externalIds 추가할 트랙의 원격 id 목록
     * @return 완료 신호
     */
    Mono<Void> addTracksToPlaylist(String remoteId, List<String> externalIds);
}
