package com.musicinsights.librarysync.infrastructure.remote.export;

import com.musicinsights.librarysync.application.sync.remote.*;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import com.musicinsights.librarysync.infrastructure.input.ndjson.NdjsonLineReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.*;

/**
 * NDJSON 라이브러리 export 디렉터리를 원격 카탈로그로 노출하는 {@link RemoteCatalog} 구현체.
 *
 * <p>읽기: {@code playlists.ndjson}, {@code albums.ndjson}, {@code artists.ndjson}(없으면 빈 목록).</p>
 * <p>쓰기: {@code mirror-outbox.ndjson}에 요청을 한 줄씩 덧붙이며,
 * 이후 읽기에서 이 기록을 다시 적용해 생성된 플레이리스트와 추가된 트랙이 보이게 한다.</p>
 */
@Component
public class LibraryExportCatalog implements RemoteCatalog {
    private static final Logger log = LoggerFactory.getLogger(LibraryExportCatalog.class);

    static final String PLAYLISTS_FILE = "playlists.ndjson";
    static final String ALBUMS_FILE = "albums.ndjson";
    static final String ARTISTS_FILE = "artists.ndjson";
    static final String OUTBOX_FILE = "mirror-outbox.ndjson";

    private final NdjsonLineReader lineReader;
    private final ObjectMapper mapper;
    private final Path directory;

    /** outbox 파일 append 직렬화용 lock */
    private final Object outboxLock = new Object();

    public LibraryExportCatalog(NdjsonLineReader lineReader, ObjectMapper mapper, LibrarySyncProperties props) {
        this.lineReader = lineReader;
        this.mapper = mapper;
        this.directory = Path.of(props.export().directory());
    }

    @Override
    public Flux<PlaylistSnapshot> fetchPlaylists() {
        Flux<PlaylistSnapshot> exported = read(PLAYLISTS_FILE, ExportPlaylistLine.class)
                .map(p -> new PlaylistSnapshot(p.id, p.title));

        return exported.collectList()
                .flatMapMany(list -> {
                    Set<String> known = new HashSet<>();
                    list.forEach(p -> known.add(p.remoteId()));
                    Flux<PlaylistSnapshot> created = outbox()
                            .filter(e -> OutboxEntry.CREATE_PLAYLIST.equals(e.op))
                            .filter(e -> known.add(e.playlistId))
                            .map(e -> new PlaylistSnapshot(e.playlistId, e.title));
                    return Flux.fromIterable(list).concatWith(created);
                });
    }

    @Override
    public Flux<TrackRecord> fetchPlaylistTracks(String remoteId) {
        return loadPlaylists()
                .zipWith(trackIndex())
                .flatMapMany(t -> {
                    Map<String, ExportPlaylistLine> playlists = t.getT1();
                    Map<String, TrackRecord> index = t.getT2();

                    ExportPlaylistLine line = playlists.get(remoteId);
                    List<TrackRecord> tracks = new ArrayList<>();
                    if (line != null && line.tracks != null) {
                        line.tracks.forEach(tl -> tracks.add(toTrack(tl)));
                    }

                    Flux<TrackRecord> appended = outbox()
                            .filter(e -> OutboxEntry.ADD_TRACKS.equals(e.op) && remoteId.equals(e.playlistId))
                            .flatMapIterable(e -> e.trackIds == null ? List.<String>of() : e.trackIds)
                            .map(id -> index.getOrDefault(id, new TrackRecord(id, null, null, List.of())));
                    return Flux.fromIterable(tracks).concatWith(appended);
                });
    }

    @Override
    public Flux<AlbumSnapshot> fetchAlbums() {
        return read(ALBUMS_FILE, ExportAlbumLine.class)
                .map(a -> new AlbumSnapshot(
                        a.id,
                        a.name,
                        toArtists(a.artists),
                        a.tracks == null ? List.of() : a.tracks.stream().map(this::toTrack).toList()
                ));
    }

    @Override
    public Flux<ArtistRef> fetchArtists() {
        return read(ARTISTS_FILE, ExportArtistLine.class)
                .map(a -> new ArtistRef(a.id, a.name));
    }

    @Override
    public Mono<String> createPlaylist(String title) {
        return Mono.fromCallable(() -> {
                    String id = "outbox-" + UUID.randomUUID();
                    append(OutboxEntry.createPlaylist(id, title, Instant.now().toString()));
                    log.info("journaled playlist creation '{}' as {}", title, id);
                    return id;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> addTracksToPlaylist(String remoteId, List<String> externalIds) {
        return fetchPlaylists()
                .any(p -> remoteId.equals(p.remoteId()))
                .flatMap(exists -> {
                    if (!exists) {
                        return Mono.error(new RemoteCatalogException("unknown playlist " + remoteId, false));
                    }
                    return Mono.fromRunnable(() -> {
                                append(OutboxEntry.addTracks(remoteId, List.copyOf(externalIds), Instant.now().toString()));
                                log.debug("journaled {} tracks for playlist {}", externalIds.size(), remoteId);
                            })
                            .subscribeOn(Schedulers.boundedElastic())
                            .then();
                });
    }

    // ---------------------------------------------------------------- reading

    private <T> Flux<T> read(String fileName, Class<T> type) {
        Path file = directory.resolve(fileName);
        return lineReader.readLines(file)
                .map(line -> parse(line, type, file));
    }

    private <T> T parse(String line, Class<T> type, Path file) {
        try {
            return mapper.readValue(line, type);
        } catch (JacksonException e) {
            throw new RemoteCatalogException("malformed line in " + file.getFileName(), e, false);
        }
    }

    private Flux<OutboxEntry> outbox() {
        return read(OUTBOX_FILE, OutboxEntry.class);
    }

    private Mono<Map<String, ExportPlaylistLine>> loadPlaylists() {
        return read(PLAYLISTS_FILE, ExportPlaylistLine.class)
                .filter(p -> p.id != null)
                .collectMap(p -> p.id, p -> p);
    }

    /** export 전체에서 id로 트랙을 찾기 위한 색인 */
    private Mono<Map<String, TrackRecord>> trackIndex() {
        Flux<ExportTrackLine> fromPlaylists = read(PLAYLISTS_FILE, ExportPlaylistLine.class)
                .flatMapIterable(p -> p.tracks == null ? List.<ExportTrackLine>of() : p.tracks);
        Flux<ExportTrackLine> fromAlbums = read(ALBUMS_FILE, ExportAlbumLine.class)
                .flatMapIterable(a -> {
                    if (a.tracks == null) return List.<ExportTrackLine>of();
                    a.tracks.stream().filter(t -> t.album == null).forEach(t -> t.album = albumRefOnly(a));
                    return a.tracks;
                });
        return fromPlaylists.concatWith(fromAlbums)
                .filter(t -> t.id != null)
                .<Map<String, TrackRecord>>collect(LinkedHashMap::new, (m, t) -> m.putIfAbsent(t.id, toTrack(t)));
    }

    // ---------------------------------------------------------------- writing

    private void append(OutboxEntry entry) {
        String line = mapper.writeValueAsString(entry) + "\n";
        synchronized (outboxLock) {
            try {
                Files.createDirectories(directory);
                Files.writeString(directory.resolve(OUTBOX_FILE), line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new RemoteCatalogException("failed to write " + OUTBOX_FILE, e, true);
            }
        }
    }

    // ---------------------------------------------------------------- mapping

    private TrackRecord toTrack(ExportTrackLine t) {
        AlbumRef album = t.album == null ? null : new AlbumRef(t.album.id, t.album.name);
        return new TrackRecord(t.id, t.name, album, toArtists(t.artists));
    }

    private static List<ArtistRef> toArtists(List<ExportArtistLine> artists) {
        if (artists == null) return List.of();
        return artists.stream()
                .filter(Objects::nonNull)
                .map(a -> new ArtistRef(a.id, a.name))
                .toList();
    }

    private static ExportAlbumLine albumRefOnly(ExportAlbumLine a) {
        ExportAlbumLine ref = new ExportAlbumLine();
        ref.id = a.id;
        ref.name = a.name;
        return ref;
    }
}
