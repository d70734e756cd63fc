package com.bit.attest.util;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 实体二进制编码辅助（统一大端）
 * 可空字段以1字节存在标记开头
 */
public final class BinaryCodec {

    // 单个变长字段的上限，防止损坏数据导致超大分配
    private static final int MAX_FIELD_LENGTH = 1 << 20;

    private BinaryCodec() {
    }

    @FunctionalInterface
    public interface Writer {
        void write(DataOutputStream dos) throws IOException;
    }

    @FunctionalInterface
    public interface Reader<T> {
        T read(DataInputStream dis) throws IOException;
    }

    public static byte[] encode(Writer writer) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            writer.write(dos);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("实体序列化失败", e);
        }
    }

    public static <T> T decode(byte[] data, Reader<T> reader) {
        if (data == null) {
            throw new IllegalArgumentException("反序列化数据不能为空");
        }
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
            return reader.read(dis);
        } catch (IOException e) {
            throw new IllegalStateException("实体反序列化失败，数据可能已损坏", e);
        }
    }

    public static void writeAddress(DataOutputStream dos, Address address) throws IOException {
        dos.write(address.toBytes());
    }

    public static Address readAddress(DataInputStream dis) throws IOException {
        byte[] bytes = new byte[Address.LENGTH];
        dis.readFully(bytes);
        return Address.fromBytes(bytes);
    }

    public static void writeNullableAddress(DataOutputStream dos, Address address) throws IOException {
        dos.writeBoolean(address != null);
        if (address != null) {
            writeAddress(dos, address);
        }
    }

    public static Address readNullableAddress(DataInputStream dis) throws IOException {
        return dis.readBoolean() ? readAddress(dis) : null;
    }

    public static void writeKey(DataOutputStream dos, ContributionKey key) throws IOException {
        dos.write(key.getBytes());
    }

    public static ContributionKey readKey(DataInputStream dis) throws IOException {
        byte[] bytes = new byte[ContributionKey.HASH_LENGTH];
        dis.readFully(bytes);
        return ContributionKey.fromBytes(bytes);
    }

    public static void writeBytes(DataOutputStream dos, byte[] bytes) throws IOException {
        dos.writeInt(bytes.length);
        dos.write(bytes);
    }

    public static byte[] readBytes(DataInputStream dis) throws IOException {
        int length = dis.readInt();
        if (length < 0 || length > MAX_FIELD_LENGTH) {
            throw new IOException("非法的字段长度: " + length);
        }
        byte[] bytes = new byte[length];
        dis.readFully(bytes);
        return bytes;
    }

    public static void writeString(DataOutputStream dos, String value) throws IOException {
        dos.writeBoolean(value != null);
        if (value != null) {
            writeBytes(dos, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    public static String readString(DataInputStream dis) throws IOException {
        return dis.readBoolean() ? new String(readBytes(dis), StandardCharsets.UTF_8) : null;
    }
}
