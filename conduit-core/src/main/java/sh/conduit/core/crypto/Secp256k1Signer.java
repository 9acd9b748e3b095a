// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic (RFC 6979) ECDSA over secp256k1 with low-s normalization.
 * <p>
 * Returned signatures carry the raw y-parity in {@code v}.
 */
final class Secp256k1Signer {

    static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1Signer() {
    }

    static Signature sign(final byte[] messageHash, final BigInteger privateKey) {
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(CURVE.getN(), privateKey, messageHash);

        final BigInteger n = CURVE.getN();
        final BigInteger z = new BigInteger(1, messageHash);
        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }

            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            // EIP-2: flipping s to n - s mirrors R, so the parity flips too
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
                v ^= 1;
            }
            return new Signature(toBytes32(r), toBytes32(s), v);
        }
    }

    static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        final byte[] result = new byte[32];
        if (bytes.length > 32) {
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        } else {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        }
        return result;
    }
}
