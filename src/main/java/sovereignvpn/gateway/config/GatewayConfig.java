package sovereignvpn.gateway.config;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Infrastructure beans shared by the ledger, reputation and housekeeping services.
 */
@Configuration
@Slf4j
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(OkHttpClient okHttpClient, GatewayProperties properties) {
        String rpcUrl = properties.getEthereum().getRpcUrl();
        // RPC URLs often embed API keys
        log.info("Connecting to Ethereum RPC for chain {}", properties.getEthereum().getChainId());
        return Web3j.build(new HttpService(rpcUrl, okHttpClient));
    }
}
