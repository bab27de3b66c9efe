package com.marketvault.data.store;

import com.marketvault.core.model.DataType;
import com.marketvault.core.model.MarketRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * File-per-partition store using {@link PartitionCodec}.
 *
 * Storage structure:
 * <dataDir>/binanceusdm/candles/1m/
 * └── BTC%2FUSDT%3AUSDT/
 *     ├── 2024-01-01.mvc
 *     ├── 2024-01-02.mvc
 *     └── ...
 *
 * Writes go to a temp file next to the target and are moved into place, so a
 * reader never sees a half-written partition.
 */
public class ColumnarPartitionStore implements PartitionStore {

    private static final Logger log = LoggerFactory.getLogger(ColumnarPartitionStore.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    static final String EXTENSION = ".mvc";
    private static final String TEMP_PREFIX = ".tmp-";

    private final Path root;
    private final PartitionCodec codec;

    public ColumnarPartitionStore(Path root) {
        this(root, new PartitionCodec());
    }

    public ColumnarPartitionStore(Path root, PartitionCodec codec) {
        this.root = root;
        this.codec = codec;
    }

    @Override
    public PartitionStatus status(PartitionId id) throws IOException {
        Path file = pathOf(id);
        if (!Files.exists(file)) {
            return PartitionStatus.ABSENT;
        }
        try (InputStream in = Files.newInputStream(file)) {
            PartitionHeader header = codec.decodeHeader(in);
            return header.complete() ? PartitionStatus.COMPLETE_PRESENT : PartitionStatus.INCOMPLETE_PRESENT;
        } catch (NoSuchFileException e) {
            return PartitionStatus.ABSENT;
        } catch (IOException e) {
            log.warn("Unreadable partition header {}, treating as absent: {}", file, e.getMessage());
            return PartitionStatus.ABSENT;
        }
    }

    @Override
    public StoredPartition read(PartitionId id) throws IOException {
        Path file = pathOf(id);
        try (InputStream in = Files.newInputStream(file)) {
            return codec.decode(in);
        } catch (NoSuchFileException e) {
            throw new PartitionNotFoundException(id);
        }
    }

    @Override
    public void write(PartitionId id, List<? extends MarketRecord> records, boolean complete) throws IOException {
        Path target = pathOf(id);
        Path dir = target.getParent();
        Files.createDirectories(dir);

        PartitionHeader header = new PartitionHeader(
            PartitionHeader.FORMAT,
            PartitionHeader.VERSION,
            id.exchange(),
            id.symbol(),
            id.dataType().id(),
            id.subTypeId(),
            complete,
            records.size(),
            records.isEmpty() ? -1 : records.get(0).timestamp(),
            records.isEmpty() ? -1 : records.get(records.size() - 1).timestamp(),
            System.currentTimeMillis(),
            PartitionCodec.columnsOf(id.dataType())
        );

        Path temp = Files.createTempFile(dir, TEMP_PREFIX + target.getFileName() + "-", ".part");
        boolean moved = false;
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING);
                 OutputStream out = Channels.newOutputStream(channel)) {
                codec.encode(header, id.dataType(), records, out);
                out.flush();
                channel.force(true);
            }
            move(temp, target);
            moved = true;
            log.debug("Wrote {} records to {} (complete={})", records.size(), target, complete);
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Set<String> listSymbols(String exchange, DataType dataType, String subTypeId) throws IOException {
        Path dir = typeDir(exchange, dataType, dataType.resolveSubType(subTypeId));
        if (!Files.isDirectory(dir)) {
            return Collections.emptySet();
        }
        Set<String> symbols = new TreeSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path entry : entries) {
                if (hasPartitions(entry)) {
                    symbols.add(URLDecoder.decode(entry.getFileName().toString(), StandardCharsets.UTF_8));
                }
            }
        }
        return symbols;
    }

    @Override
    public List<LocalDate> listPartitionKeys(String exchange, DataType dataType, String subTypeId, String symbol)
            throws IOException {
        Path dir = typeDir(exchange, dataType, dataType.resolveSubType(subTypeId)).resolve(encode(symbol));
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<LocalDate> keys = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.startsWith(TEMP_PREFIX)) {
                    continue;
                }
                try {
                    keys.add(LocalDate.parse(name.substring(0, name.length() - EXTENSION.length()), DATE_FORMAT));
                } catch (DateTimeParseException e) {
                    log.warn("Ignoring unexpected file {} in {}", name, dir);
                }
            }
        }
        Collections.sort(keys);
        return keys;
    }

    /**
     * File path for a partition.
     */
    public Path pathOf(PartitionId id) {
        return typeDir(id.exchange(), id.dataType(), id.subTypeId())
            .resolve(encode(id.symbol()))
            .resolve(DATE_FORMAT.format(id.partitionKey()) + EXTENSION);
    }

    private Path typeDir(String exchange, DataType dataType, String subTypeId) {
        return root.resolve(encode(exchange)).resolve(dataType.id()).resolve(encode(subTypeId));
    }

    private static boolean hasPartitions(Path symbolDir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(symbolDir, "*" + EXTENSION)) {
            for (Path entry : entries) {
                if (!entry.getFileName().toString().startsWith(TEMP_PREFIX)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
