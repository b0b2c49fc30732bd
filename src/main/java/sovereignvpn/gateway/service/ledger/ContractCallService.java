package sovereignvpn.gateway.service.ledger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.LedgerException;

/**
 * Read-only {@code eth_call} against the latest block, bounded by the configured call timeout.
 */
@Service
@Slf4j
public class ContractCallService {

    private final Web3j web3j;
    private final Duration callTimeout;

    public ContractCallService(Web3j web3j, GatewayProperties properties) {
        this.web3j = web3j;
        this.callTimeout = properties.getEthereum().getCallTimeout();
    }

    /**
     * Encodes {@code function}, executes it against {@code contractAddress} and decodes the outputs.
     *
     * @throws LedgerException on transport errors, timeouts, reverts or an empty answer
     */
    @SuppressWarnings("rawtypes")
    public List<Type> call(String contractAddress, Function function) {
        String operation = function.getName();
        String encoded = FunctionEncoder.encode(function);
        EthCall response;
        try {
            response = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contractAddress, encoded),
                    DefaultBlockParameterName.LATEST)
                .sendAsync()
                .get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException(operation, "interrupted while calling " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LedgerException(operation, operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new LedgerException(operation, operation + " timed out after " + callTimeout.toMillis() + "ms", e);
        }

        if (response == null) {
            throw new LedgerException(operation, operation + " returned no response");
        }
        if (response.hasError()) {
            throw new LedgerException(operation, operation + " reverted: " + response.getError().getMessage());
        }
        String value = response.getValue();
        if (value == null || value.equals("0x")) {
            throw new LedgerException(operation, operation + " returned empty data from " + contractAddress);
        }
        List<Type> decoded = FunctionReturnDecoder.decode(value, function.getOutputParameters());
        if (decoded.size() != function.getOutputParameters().size()) {
            throw new LedgerException(operation, operation + " returned " + decoded.size() + " values, expected "
                + function.getOutputParameters().size());
        }
        log.debug("{} on {} decoded {} values", operation, contractAddress, decoded.size());
        return decoded;
    }
}
