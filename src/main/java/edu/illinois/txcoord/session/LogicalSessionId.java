package edu.illinois.txcoord.session;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.UUID;

import org.apache.hadoop.io.DataInputBuffer;
import org.apache.hadoop.io.DataOutputBuffer;
import org.apache.hadoop.io.Writable;

/**
 * Identifies a client logical session. Sessions are created by clients; the
 * coordinator side only compares and hashes them.
 */
public class LogicalSessionId implements Writable,
    Comparable<LogicalSessionId> {

  private long mostSigBits;
  private long leastSigBits;

  // for serialization only
  public LogicalSessionId() {
    super();
  }

  public LogicalSessionId(UUID id) {
    this.mostSigBits = id.getMostSignificantBits();
    this.leastSigBits = id.getLeastSignificantBits();
  }

  public LogicalSessionId(byte[] bytes) {
    DataInputBuffer in = new DataInputBuffer();
    in.reset(bytes, bytes.length);
    try {
      readFields(in);
      in.close();
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }

  public static LogicalSessionId generate() {
    return new LogicalSessionId(UUID.randomUUID());
  }

  public UUID getId() {
    return new UUID(mostSigBits, leastSigBits);
  }

  public byte[] toBytes() {
    DataOutputBuffer out = new DataOutputBuffer();
    try {
      write(out);
      out.close();
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
    byte[] bytes = new byte[out.getLength()];
    System.arraycopy(out.getData(), 0, bytes, 0, bytes.length);
    return bytes;
  }

  @Override
  public int compareTo(LogicalSessionId other) {
    return getId().compareTo(other.getId());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LogicalSessionId))
      return false;
    LogicalSessionId other = (LogicalSessionId) obj;
    return mostSigBits == other.mostSigBits
        && leastSigBits == other.leastSigBits;
  }

  @Override
  public int hashCode() {
    long bits = mostSigBits ^ leastSigBits;
    return (int) (bits >> 32) ^ (int) bits;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeLong(mostSigBits);
    out.writeLong(leastSigBits);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    this.mostSigBits = in.readLong();
    this.leastSigBits = in.readLong();
  }

  @Override
  public String toString() {
    return "{ id: " + getId() + " }";
  }
}
