package com.resourcelocator.application;

import com.resourcelocator.domain.model.CapabilityKind;
import com.resourcelocator.domain.model.ConnectionDescriptor;

import java.util.Objects;

/**
 * Authority granted by a redeemed token.
 *
 * <p>Each variant exposes exactly the operation it authorizes; a {@link Read} has no
 * way to write. Callers either downcast after checking {@link #getKind()} or use a
 * {@link Visitor} for exhaustive handling.
 *
 * <p>Instances are only created by {@link SecureResourceLocator#redeem} after the
 * token validated.
 */
public abstract class Capability {

    private final String logicalName;
    private final ConnectionDescriptor descriptor;

    private Capability(String logicalName, ConnectionDescriptor descriptor) {
        this.logicalName = Objects.requireNonNull(logicalName, "logicalName");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    static Capability of(CapabilityKind kind, String logicalName, ConnectionDescriptor descriptor) {
        switch (kind) {
            case READ:
                return new Read(logicalName, descriptor);
            case WRITE:
                return new Write(logicalName, descriptor);
            case DELETE:
                return new Delete(logicalName, descriptor);
            case SEARCH:
                return new Search(logicalName, descriptor);
            default:
                throw new IllegalArgumentException("Unsupported capability: " + kind);
        }
    }

    public String getLogicalName() {
        return logicalName;
    }

    public abstract CapabilityKind getKind();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Each call hands the dispatcher its own copy of the descriptor.
     */
    ConnectionDescriptor descriptor() {
        return descriptor.copy();
    }

    @Override
    public String toString() {
        return getKind() + "[" + logicalName + " -> " + descriptor.physicalResource() + "]";
    }

    public interface Visitor<R> {
        R visitRead(Read read);

        R visitWrite(Write write);

        R visitDelete(Delete delete);

        R visitSearch(Search search);
    }

    public static final class Read extends Capability {
        private Read(String logicalName, ConnectionDescriptor descriptor) {
            super(logicalName, descriptor);
        }

        public <T> T read(ResourceAccess.Reader<T> reader) {
            return reader.read(descriptor());
        }

        @Override
        public CapabilityKind getKind() {
            return CapabilityKind.READ;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRead(this);
        }
    }

    public static final class Write extends Capability {
        private Write(String logicalName, ConnectionDescriptor descriptor) {
            super(logicalName, descriptor);
        }

        public <T> T write(ResourceAccess.Writer<T> writer) {
            return writer.write(descriptor());
        }

        @Override
        public CapabilityKind getKind() {
            return CapabilityKind.WRITE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWrite(this);
        }
    }

    public static final class Delete extends Capability {
        private Delete(String logicalName, ConnectionDescriptor descriptor) {
            super(logicalName, descriptor);
        }

        public <T> T delete(ResourceAccess.Deleter<T> deleter) {
            return deleter.delete(descriptor());
        }

        @Override
        public CapabilityKind getKind() {
            return CapabilityKind.DELETE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    public static final class Search extends Capability {
        private Search(String logicalName, ConnectionDescriptor descriptor) {
            super(logicalName, descriptor);
        }

        public <T> T search(String query, ResourceAccess.Searcher<T> searcher) {
            Objects.requireNonNull(query, "query");
            return searcher.search(descriptor(), query);
        }

        @Override
        public CapabilityKind getKind() {
            return CapabilityKind.SEARCH;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSearch(this);
        }
    }
}
