package io.ringhandoff.handoff.transfer;

import io.ringhandoff.handoff.model.TransportOptions;
import io.ringhandoff.handoff.vnode.VnodeHandle;

/**
 * Supplies the bodies of sender and receiver units. Implementations own the wire protocol.
 * Instances are created reflectively from configuration and need a public no-arg constructor,
 * or a public constructor taking {@link java.util.Map} of provider settings.
 */
public interface TransferTaskProvider {

    TransferTask sender(int targetNode, String module, int partition, VnodeHandle vnode);

    TransferTask receiver(TransportOptions options);
}
