package sovereignvpn.gateway.service.ledger;

import java.io.IOException;
import java.math.BigInteger;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.tx.FastRawTransactionManager;
import org.web3j.tx.TransactionManager;
import sovereignvpn.gateway.exception.LedgerException;

/**
 * Signs and broadcasts contract transactions from one operator key.
 * Submissions are serialized so the locally tracked nonce stays consistent.
 */
@Slf4j
public class TransactionSubmitter {

    private final Web3j web3j;
    private final TransactionManager txManager;
    private final String fromAddress;

    public TransactionSubmitter(Web3j web3j, Credentials credentials, long chainId) {
        this.web3j = web3j;
        this.txManager = new FastRawTransactionManager(web3j, credentials, chainId);
        this.fromAddress = credentials.getAddress();
    }

    public String getFromAddress() {
        return fromAddress;
    }

    /**
     * @return the transaction hash; the receipt is not awaited
     */
    public synchronized String submit(String contractAddress, Function function, BigInteger gasLimit) {
        String operation = function.getName();
        String encoded = FunctionEncoder.encode(function);
        EthSendTransaction tx;
        try {
            BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
            tx = txManager.sendTransaction(gasPrice, gasLimit, contractAddress, encoded, BigInteger.ZERO);
        } catch (IOException e) {
            throw new LedgerException(operation, "failed to send " + operation + ": " + e.getMessage(), e);
        }

        String txHash = tx.getTransactionHash();
        if (txHash == null || tx.hasError()) {
            String error = tx.getError() != null ? tx.getError().getMessage() : "tx_hash_missing";
            throw new LedgerException(operation, operation + " transaction failed: " + error);
        }
        log.info("{} submitted from {}: {}", operation, fromAddress, txHash);
        return txHash;
    }
}
