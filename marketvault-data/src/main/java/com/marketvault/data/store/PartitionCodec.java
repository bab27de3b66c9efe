package com.marketvault.data.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketvault.core.model.Candle;
import com.marketvault.core.model.DataType;
import com.marketvault.core.model.FundingRate;
import com.marketvault.core.model.MarketRecord;
import com.marketvault.core.model.Trade;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Columnar partition encoding.
 *
 * Layout (inside a GZIP stream): a msgpack binary blob holding the
 * {@link PartitionHeader}, then one msgpack array per column with
 * {@code rowCount} entries each. The timestamp column comes first.
 */
public class PartitionCodec {

    static final List<String> CANDLE_COLUMNS = List.of("timestamp", "open", "high", "low", "close", "volume");
    static final List<String> TRADE_COLUMNS = List.of("timestamp", "id", "side", "price", "amount", "cost");
    static final List<String> FUNDING_COLUMNS = List.of("timestamp", "fundingRate", "markPrice");

    private final ObjectMapper headerMapper = new ObjectMapper(new MessagePackFactory());

    public static List<String> columnsOf(DataType dataType) {
        return switch (dataType) {
            case CANDLES -> CANDLE_COLUMNS;
            case TRADES -> TRADE_COLUMNS;
            case FUNDING -> FUNDING_COLUMNS;
        };
    }

    public void encode(PartitionHeader header, DataType dataType, List<? extends MarketRecord> records,
                       OutputStream out) throws IOException {
        if (header.rowCount() != records.size()) {
            throw new IllegalArgumentException("Header rowCount " + header.rowCount()
                + " does not match " + records.size() + " records");
        }
        GZIPOutputStream gzip = new GZIPOutputStream(out);
        MessagePacker packer = MessagePack.newDefaultPacker(gzip);

        byte[] headerBytes = headerMapper.writeValueAsBytes(header);
        packer.packBinaryHeader(headerBytes.length);
        packer.writePayload(headerBytes);

        int rows = records.size();
        packer.packArrayHeader(rows);
        for (MarketRecord record : records) {
            packer.packLong(record.timestamp());
        }

        switch (dataType) {
            case CANDLES -> {
                List<Candle> candles = cast(records, Candle.class);
                packDoubles(packer, candles, Candle::open);
                packDoubles(packer, candles, Candle::high);
                packDoubles(packer, candles, Candle::low);
                packDoubles(packer, candles, Candle::close);
                packDoubles(packer, candles, Candle::volume);
            }
            case TRADES -> {
                List<Trade> trades = cast(records, Trade.class);
                packStrings(packer, trades, Trade::id);
                packStrings(packer, trades, Trade::side);
                packDoubles(packer, trades, Trade::price);
                packDoubles(packer, trades, Trade::amount);
                packDoubles(packer, trades, Trade::cost);
            }
            case FUNDING -> {
                List<FundingRate> rates = cast(records, FundingRate.class);
                packDoubles(packer, rates, FundingRate::fundingRate);
                packDoubles(packer, rates, FundingRate::markPrice);
            }
        }

        packer.flush();
        gzip.finish();
    }

    /**
     * Read only the header; the column data is not decompressed.
     */
    public PartitionHeader decodeHeader(InputStream in) throws IOException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(new GZIPInputStream(in))) {
            return readHeader(unpacker);
        } catch (MessagePackException e) {
            throw new IOException("Malformed partition header", e);
        }
    }

    public StoredPartition decode(InputStream in) throws IOException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(new GZIPInputStream(in))) {
            PartitionHeader header = readHeader(unpacker);
            DataType dataType = DataType.fromId(header.dataType());
            String symbol = header.symbol();
            int rows = header.rowCount();

            long[] timestamps = new long[expectColumn(unpacker, rows, "timestamp")];
            for (int i = 0; i < rows; i++) {
                timestamps[i] = unpacker.unpackLong();
            }

            List<MarketRecord> records = new ArrayList<>(rows);
            switch (dataType) {
                case CANDLES -> {
                    double[] open = readDoubles(unpacker, rows, "open");
                    double[] high = readDoubles(unpacker, rows, "high");
                    double[] low = readDoubles(unpacker, rows, "low");
                    double[] close = readDoubles(unpacker, rows, "close");
                    double[] volume = readDoubles(unpacker, rows, "volume");
                    for (int i = 0; i < rows; i++) {
                        records.add(new Candle(symbol, timestamps[i], open[i], high[i], low[i], close[i], volume[i]));
                    }
                }
                case TRADES -> {
                    String[] ids = readStrings(unpacker, rows, "id");
                    String[] sides = readStrings(unpacker, rows, "side");
                    double[] price = readDoubles(unpacker, rows, "price");
                    double[] amount = readDoubles(unpacker, rows, "amount");
                    double[] cost = readDoubles(unpacker, rows, "cost");
                    for (int i = 0; i < rows; i++) {
                        records.add(new Trade(symbol, timestamps[i], ids[i], sides[i], price[i], amount[i], cost[i]));
                    }
                }
                case FUNDING -> {
                    double[] rate = readDoubles(unpacker, rows, "fundingRate");
                    double[] mark = readDoubles(unpacker, rows, "markPrice");
                    for (int i = 0; i < rows; i++) {
                        records.add(new FundingRate(symbol, timestamps[i], rate[i], mark[i]));
                    }
                }
            }
            return new StoredPartition(header, records);
        } catch (MessagePackException | IllegalArgumentException e) {
            throw new IOException("Malformed partition data", e);
        }
    }

    private PartitionHeader readHeader(MessageUnpacker unpacker) throws IOException {
        int length = unpacker.unpackBinaryHeader();
        byte[] bytes = unpacker.readPayload(length);
        PartitionHeader header = headerMapper.readValue(bytes, PartitionHeader.class);
        if (!PartitionHeader.FORMAT.equals(header.format())) {
            throw new IOException("Not a partition file (format " + header.format() + ")");
        }
        if (header.version() != PartitionHeader.VERSION) {
            throw new IOException("Unsupported partition version " + header.version());
        }
        return header;
    }

    private static int expectColumn(MessageUnpacker unpacker, int rows, String column) throws IOException {
        int size = unpacker.unpackArrayHeader();
        if (size != rows) {
            throw new IOException("Column " + column + " has " + size + " values, expected " + rows);
        }
        return size;
    }

    private static double[] readDoubles(MessageUnpacker unpacker, int rows, String column) throws IOException {
        double[] values = new double[expectColumn(unpacker, rows, column)];
        for (int i = 0; i < rows; i++) {
            values[i] = unpacker.unpackDouble();
        }
        return values;
    }

    private static String[] readStrings(MessageUnpacker unpacker, int rows, String column) throws IOException {
        String[] values = new String[expectColumn(unpacker, rows, column)];
        for (int i = 0; i < rows; i++) {
            values[i] = unpacker.tryUnpackNil() ? "" : unpacker.unpackString();
        }
        return values;
    }

    private static <T> void packDoubles(MessagePacker packer, List<T> rows, ToDoubleFunction<T> column)
            throws IOException {
        packer.packArrayHeader(rows.size());
        for (T row : rows) {
            packer.packDouble(column.applyAsDouble(row));
        }
    }

    private static <T> void packStrings(MessagePacker packer, List<T> rows, Function<T, String> column)
            throws IOException {
        packer.packArrayHeader(rows.size());
        for (T row : rows) {
            String value = column.apply(row);
            if (value == null) {
                packer.packNil();
            } else {
                packer.packString(value);
            }
        }
    }

    private static <T> List<T> cast(List<? extends MarketRecord> records, Class<T> type) {
        List<T> typed = new ArrayList<>(records.size());
        for (MarketRecord record : records) {
            if (!type.isInstance(record)) {
                throw new IllegalArgumentException("Expected " + type.getSimpleName() + " but got "
                    + record.getClass().getSimpleName());
            }
            typed.add(type.cast(record));
        }
        return typed;
    }
}
