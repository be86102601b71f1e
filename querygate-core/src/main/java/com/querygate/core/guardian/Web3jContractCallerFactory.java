package com.querygate.core.guardian;

import com.querygate.core.spi.ContractCaller;
import com.querygate.core.spi.ContractCallerFactory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.http.HttpService;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 基于 web3j HTTP 传输的合约调用工厂
 * <p>
 * 所有客户端共享一个 OkHttp 连接池；每次 open 按给定超时派生新的客户端，
 * 使截止时间在传输层也生效，而不只是调用方放弃等待。
 * 每个调用方独占一个 Dispatcher，取消或关闭时中止其上所有进行中的 HTTP 请求。
 * </p>
 */
@Slf4j
public class Web3jContractCallerFactory implements ContractCallerFactory, Closeable {

    private final OkHttpClient baseClient;
    private final boolean ownsBaseClient;

    // web3j 要求提供轮询调度器；这里只做单次 eth_call，不会真正轮询
    private final ScheduledExecutorService pollingExecutor = Executors.newSingleThreadScheduledExecutor(
            r -> {
                Thread t = new Thread(r, "querygate-web3j-poller");
                t.setDaemon(true);
                return t;
            }
    );

    public Web3jContractCallerFactory() {
        this(new OkHttpClient(), true);
    }

    public Web3jContractCallerFactory(OkHttpClient baseClient) {
        this(baseClient, false);
    }

    private Web3jContractCallerFactory(OkHttpClient baseClient, boolean ownsBaseClient) {
        this.baseClient = baseClient;
        this.ownsBaseClient = ownsBaseClient;
    }

    @Override
    public ContractCaller open(String rpcUrl, Duration timeout) {
        if (isClosed()) {
            throw new IllegalStateException("contract caller factory is closed");
        }
        OkHttpClient client = baseClient.newBuilder()
                .dispatcher(new Dispatcher())
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
        HttpService service = new HttpService(rpcUrl, client);
        return new Web3jContractCaller(client.dispatcher(), service, Web3j.build(service, 1_000L, pollingExecutor));
    }

    @Override
    public void close() {
        pollingExecutor.shutdownNow();
        if (ownsBaseClient) {
            baseClient.connectionPool().evictAll();
        }
        log.debug("Web3j contract caller factory closed");
    }

    public boolean isClosed() {
        return pollingExecutor.isShutdown();
    }

    private static final class Web3jContractCaller implements ContractCaller {

        private final Dispatcher dispatcher;
        private final HttpService service;
        private final Web3j web3j;

        private Web3jContractCaller(Dispatcher dispatcher, HttpService service, Web3j web3j) {
            this.dispatcher = dispatcher;
            this.service = service;
            this.web3j = web3j;
        }

        @Override
        public CompletableFuture<String> call(String contractAddress, String encodedFunction) {
            Transaction tx = Transaction.createEthCallTransaction(null, contractAddress, encodedFunction);
            CompletableFuture<String> result = web3j.ethCall(tx, DefaultBlockParameterName.LATEST)
                    .sendAsync()
                    .thenApply(response -> unwrap(contractAddress, response));
            // sendAsync 在 web3j 线程池里阻塞执行，取消 Future 本身不会中止 HTTP 请求
            result.whenComplete((value, error) -> {
                if (result.isCancelled()) {
                    dispatcher.cancelAll();
                }
            });
            return result;
        }

        private static String unwrap(String contractAddress, EthCall response) {
            if (response.hasError()) {
                throw new ContractCallException("eth_call to " + contractAddress + " failed: "
                        + response.getError().getMessage());
            }
            if (response.isReverted()) {
                throw new ContractCallException("eth_call to " + contractAddress + " reverted: "
                        + response.getRevertReason());
            }
            return response.getValue();
        }

        @Override
        public void close() {
            // 调度器由工厂共享，此处只中止本调用方的请求并释放 HTTP 服务
            dispatcher.cancelAll();
            try {
                service.close();
            } catch (Exception e) {
                log.warn("Failed to close web3j http service", e);
            }
        }
    }
}
