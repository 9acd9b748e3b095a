// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.primitives.rlp;

/**
 * A node in an RLP structure: either a byte string or a list of nodes.
 */
public sealed interface RlpItem permits RlpString, RlpList {

    /**
     * @return the RLP encoding of this item
     */
    byte[] encode();
}
