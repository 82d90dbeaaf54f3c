package io.norberg.h2engine;

import static io.norberg.h2engine.Http2Error.PROTOCOL_ERROR;
import static io.norberg.h2engine.Http2Exception.connectionError;
import static io.norberg.h2engine.Http2Protocol.MAX_STREAM_ID;

import io.netty.util.collection.IntObjectHashMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * The table of active client initiated streams. Streams leave the table when they close, but their ids stay used:
 * any id at or below {@link #lastLocalStreamId()} that is not in the table is a closed stream.
 */
class StreamController<STREAM extends Http2Stream> implements Iterable<STREAM> {

  private final IntObjectHashMap<STREAM> streams = new IntObjectHashMap<>();

  private int lastLocalStreamId;

  /**
   * The id the next locally opened stream will get, or {@code -1} if the id space is exhausted.
   */
  int nextStreamId() {
    final long next = (lastLocalStreamId == 0) ? 1 : (long) lastLocalStreamId + 2;
    return next > MAX_STREAM_ID ? -1 : (int) next;
  }

  int lastLocalStreamId() {
    return lastLocalStreamId;
  }

  /**
   * Register a newly opened local stream. Its id must be odd and above every id used before.
   */
  STREAM addStream(final STREAM stream) throws Http2Exception {
    final int id = stream.id;
    if ((id & 1) == 0) {
      throw connectionError(PROTOCOL_ERROR, "client stream id must be odd: %d", id);
    }
    if (id <= lastLocalStreamId) {
      throw connectionError(PROTOCOL_ERROR, "stream id %d not above last used id %d", id, lastLocalStreamId);
    }
    lastLocalStreamId = id;
    streams.put(id, stream);
    return stream;
  }

  STREAM removeStream(final int id) {
    return streams.remove(id);
  }

  int streams() {
    return streams.size();
  }

  STREAM stream(final int id) {
    return streams.get(id);
  }

  /**
   * The state of any stream id, including ids that are not in the table. Even ids are always idle since the peer
   * cannot open streams of its own.
   */
  StreamState state(final int id) {
    final STREAM stream = streams.get(id);
    if (stream != null) {
      return stream.state;
    }
    if ((id & 1) == 0 || id > lastLocalStreamId) {
      return StreamState.IDLE;
    }
    return StreamState.CLOSED;
  }

  boolean isActive(final int id) {
    return streams.containsKey(id);
  }

  /**
   * A snapshot of the active streams, safe to use while streams are removed.
   */
  List<STREAM> snapshot() {
    return new ArrayList<>(streams.values());
  }

  @Override
  public Iterator<STREAM> iterator() {
    return streams.values().iterator();
  }

  @Override
  public void forEach(final Consumer<? super STREAM> action) {
    streams.values().forEach(action);
  }

  @Override
  public Spliterator<STREAM> spliterator() {
    return streams.values().spliterator();
  }
}
