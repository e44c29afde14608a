package com.musicinsights.librarysync.support;

import com.musicinsights.librarysync.application.sync.remote.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 메모리 위에서 동작하는 테스트용 {@link RemoteCatalog}.
 *
 * <p>원격 라이브러리 상태를 직접 조작하고, 쓰기 호출 횟수를 기록한다.</p>
 */
public class FakeRemoteCatalog implements RemoteCatalog {

    private final Map<String, String> playlistTitles = new LinkedHashMap<>();
    private final Map<String, List<TrackRecord>> playlistTracks = new LinkedHashMap<>();
    private final List<AlbumSnapshot> albums = new ArrayList<>();
    private final List<ArtistRef> artists = new ArrayList<>();

    public final AtomicInteger createCalls = new AtomicInteger();
    public final AtomicInteger addCalls = new AtomicInteger();

    private volatile RuntimeException fetchFailure;
    private volatile RuntimeException addFailure;
    private volatile Runnable afterAdd;
    private int idSeq = 0;

    public synchronized void reset() {
        playlistTitles.clear();
        playlistTracks.clear();
        albums.clear();
        artists.clear();
        createCalls.set(0);
        addCalls.set(0);
        fetchFailure = null;
        addFailure = null;
        afterAdd = null;
    }

    public synchronized FakeRemoteCatalog playlist(String remoteId, String title, TrackRecord... tracks) {
        playlistTitles.put(remoteId, title);
        playlistTracks.put(remoteId, new ArrayList<>(List.of(tracks)));
        return this;
    }

    public synchronized FakeRemoteCatalog removePlaylist(String remoteId) {
        playlistTitles.remove(remoteId);
        playlistTracks.remove(remoteId);
        return this;
    }

    public synchronized FakeRemoteCatalog savedAlbum(AlbumSnapshot album) {
        albums.add(album);
        return this;
    }

    public synchronized FakeRemoteCatalog savedArtist(ArtistRef artist) {
        artists.add(artist);
        return this;
    }

    public void failFetchWith(RuntimeException e) {
        this.fetchFailure = e;
    }

    public void failAddWith(RuntimeException e) {
        this.addFailure = e;
    }

    /** 트랙 추가가 성공할 때마다 실행할 동작 */
    public void afterEachAdd(Runnable action) {
        this.afterAdd = action;
    }

    /** 원격 플레이리스트에 담긴 트랙 id 목록 */
    public synchronized List<String> trackIdsOf(String remoteId) {
        return playlistTracks.getOrDefault(remoteId, List.of()).stream()
                .map(TrackRecord::externalId)
                .toList();
    }

    public synchronized String remoteIdOfTitle(String title) {
        return playlistTitles.entrySet().stream()
                .filter(e -> title.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }

    public static TrackRecord track(String id, String name, String albumId, String albumName, String... artistNames) {
        List<ArtistRef> refs = new ArrayList<>();
        for (String a : artistNames) refs.add(new ArtistRef("ar-" + a, a));
        return new TrackRecord(id, name, albumId == null ? null : new AlbumRef(albumId, albumName), refs);
    }

    @Override
    public synchronized Flux<PlaylistSnapshot> fetchPlaylists() {
        if (fetchFailure != null) return Flux.error(fetchFailure);
        List<PlaylistSnapshot> out = new ArrayList<>();
        playlistTitles.forEach((id, title) -> out.add(new PlaylistSnapshot(id, title)));
        return Flux.fromIterable(out);
    }

    @Override
    public synchronized Flux<TrackRecord> fetchPlaylistTracks(String remoteId) {
        if (fetchFailure != null) return Flux.error(fetchFailure);
        return Flux.fromIterable(List.copyOf(playlistTracks.getOrDefault(remoteId, List.of())));
    }

    @Override
    public synchronized Flux<AlbumSnapshot> fetchAlbums() {
        return Flux.fromIterable(List.copyOf(albums));
    }

    @Override
    public synchronized Flux<ArtistRef> fetchArtists() {
        return Flux.fromIterable(List.copyOf(artists));
    }

    @Override
    public Mono<String> createPlaylist(String title) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                createCalls.incrementAndGet();
                String id = "remote-pl-" + (++idSeq);
                playlistTitles.put(id, title);
                playlistTracks.put(id, new ArrayList<>());
                return id;
            }
        });
    }

    @Override
    public Mono<Void> addTracksToPlaylist(String remoteId, List<String> externalIds) {
        return Mono.defer(() -> {
            if (addFailure != null) return Mono.error(addFailure);
            synchronized (this) {
                addCalls.incrementAndGet();
                List<TrackRecord> target = playlistTracks.get(remoteId);
                if (target == null) {
                    return Mono.error(new RemoteCatalogException("unknown playlist " + remoteId, false));
                }
                externalIds.forEach(id -> target.add(new TrackRecord(id, id, null, List.of())));
            }
            Runnable action = afterAdd;
            if (action != null) action.run();
            return Mono.empty();
        });
    }
}
