package com.dexarb.infra.pool;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.PoolDescriptor;
import com.dexarb.domain.PoolStateUpdate;
import com.dexarb.domain.Token;
import com.dexarb.infra.ChainAccessException;
import com.dexarb.infra.Web3Service;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class UniswapV2PoolAdapterTest {

    private static final Token WETH = Token.of("0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", "WETH", 18);
    private static final Token USDC = Token.of("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", "USDC", 6);
    private static final String PAIR = "0xb4e16d0168e52d35cacd2c6185b44281ec28c9dc";

    private Web3Service web3Service;
    private UniswapV2PoolAdapter adapter;
    private PoolDescriptor pool;

    @BeforeEach
    void setUp() {
        web3Service = mock(Web3Service.class);
        ArbProperties properties = new ArbProperties();
        properties.getChain().setPollInterval(Duration.ofMillis(20));
        adapter = new UniswapV2PoolAdapter(web3Service, properties);
        pool = PoolDescriptor.builder()
                .address(PAIR)
                .venue("uniswap_v2")
                .token0(USDC)
                .token1(WETH)
                .feeBps(30)
                .build();
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    private static String reserves(BigInteger r0, BigInteger r1, long timestamp) {
        return "0x" + TypeEncoder.encode(new Uint112(r0))
                + TypeEncoder.encode(new Uint112(r1))
                + TypeEncoder.encode(new Uint32(BigInteger.valueOf(timestamp)));
    }

    @Test
    void testSupportsConfiguredVenuesOnly() {
        assertTrue(adapter.supports("uniswap_v2"));
        assertTrue(adapter.supports("SushiSwap"));
        assertFalse(adapter.supports("curve"));
        assertFalse(adapter.supports(null));
    }

    @Test
    void testReadDecodesReserves() {
        BigInteger usdc = new BigInteger("30000000000000");           // 30M USDC
        BigInteger weth = new BigInteger("10000000000000000000000");  // 10k WETH
        when(web3Service.currentBlockNumber()).thenReturn(19_000_000L);
        when(web3Service.call(eq(PAIR), anyString())).thenReturn(reserves(usdc, weth, 1714564800L));

        PoolStateUpdate update = adapter.read(pool);

        assertEquals(usdc, update.getReserve0());
        assertEquals(weth, update.getReserve1());
        assertEquals(19_000_000L, update.getBlockNumber());
        assertEquals(30, update.getFeeBps());
        assertFalse(update.isDelisted());
    }

    @Test
    void testEmptyReturnMeansDelisted() {
        when(web3Service.currentBlockNumber()).thenReturn(19_000_001L);
        when(web3Service.call(eq(PAIR), anyString())).thenReturn("0x");

        PoolStateUpdate update = adapter.read(pool);

        assertTrue(update.isDelisted());
        assertNull(update.getReserve0());
    }

    @Test
    void testSubscriptionPollsUntilClosed() throws Exception {
        when(web3Service.currentBlockNumber()).thenReturn(1L, 2L, 3L, 4L, 5L);
        when(web3Service.call(eq(PAIR), anyString()))
                .thenThrow(new ChainAccessException("eth_call failed"))
                .thenReturn(reserves(BigInteger.TEN, BigInteger.TWO, 0));
        List<PoolStateUpdate> received = new CopyOnWriteArrayList<>();

        PoolAdapter.Subscription subscription = adapter.subscribe(pool, received::add);

        // a failed read is skipped and the next poll still runs
        verify(web3Service, timeout(2000).atLeast(3)).call(eq(PAIR), anyString());
        subscription.close();
        assertFalse(received.isEmpty());
        assertEquals(BigInteger.TEN, received.get(0).getReserve0());
    }
}
