package io.synclane.lfs;

import io.synclane.model.PointerRecord;
import io.synclane.model.TransferDescriptor;
import io.synclane.model.TransferDirection;

import java.nio.file.Path;
import java.util.List;

public interface LfsTransport {
    BatchResponse batch(TransferDirection direction, List<PointerRecord> objects) throws TransferException;

    void download(TransferDescriptor descriptor, Path target) throws TransferException;

    void upload(TransferDescriptor descriptor, Path source) throws TransferException;

    record BatchResponse(List<TransferDescriptor> descriptors, List<ObjectError> errors) {
        public BatchResponse {
            descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
            errors = errors == null ? List.of() : List.copyOf(errors);
        }
    }

    record ObjectError(String oid, int code, String message) {
    }
}
