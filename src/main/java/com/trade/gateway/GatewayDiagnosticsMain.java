package com.trade.gateway;

import com.trade.gateway.balance.SharedStoreProvider;
import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.core.MarketType;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.UnifiedBalance;
import com.trade.gateway.core.UnifiedPosition;
import com.trade.gateway.exchange.ExchangeGateway;
import com.trade.gateway.exchange.ExchangeRegistry;
import com.trade.gateway.exchange.GatewayConfig;
import com.trade.gateway.exchange.GatewayException;
import com.trade.gateway.exchange.GatewayListener;
import com.trade.gateway.exchange.preflight.PreflightResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 交易所连接测试
 * 用法: GatewayDiagnosticsMain [exchange] [symbol]
 * 依次执行预检查、加载市场、查询余额、持仓和行情
 */
public class GatewayDiagnosticsMain {

    public static void main(String[] args) {
        ConfigManager configManager = ConfigManager.getInstance();
        String exchangeName = args.length > 0 ? args[0]
                : configManager.getProperty("exchange.name", "binance", "EXCHANGE");

        System.out.println("""
            ================================================
               交易所连接测试
            ================================================
            """);

        ExchangeRegistry registry = ExchangeRegistry.withBuiltins();
        if (!registry.isSupported(exchangeName)) {
            System.err.println("不支持的交易所: " + exchangeName + "，可用: " + registry.getSupportedExchanges());
            System.exit(2);
        }

        GatewayConfig config = GatewayConfig.fromConfig(configManager, exchangeName);
        String symbol = args.length > 1 ? args[1]
                : config.getDefaultType() == MarketType.SPOT ? "BTC/USDT" : "BTC/USDT:USDT";
        System.out.println("交易所: " + exchangeName + "  沙盒: " + config.isSandbox()
                + "  市场类型: " + config.getDefaultType().getCode());

        int exitCode = 0;
        ExchangeGateway gateway = registry.getInstance(exchangeName, config);
        gateway.addListener(new GatewayListener() {
            @Override
            public void onRetry(RetryEvent event) {
                System.out.println("  重试 " + event.operation() + " 第 " + event.attempt() + " 次，等待 "
                        + event.delayMs() + "ms");
            }
        });
        try {
            gateway.connect();
            printPreflight(gateway.getLastPreflight());
            System.out.println("\n✓ 连接成功");

            if (config.hasCredentials()) {
                printBalance(gateway.fetchBalance());
                printPositions(gateway.fetchPositions());
            } else {
                System.out.println("\n未配置 API 密钥，跳过余额与持仓查询");
            }

            Ticker ticker = gateway.fetchTicker(symbol);
            System.out.println("\n行情 " + ticker.getSymbol() + ": last=" + ticker.getLastPrice()
                    + " bid=" + ticker.getBidPrice() + " ask=" + ticker.getAskPrice());
            gateway.getPrecision(ticker.getSymbol()).ifPresent(p ->
                    System.out.println("精度: price=" + p.price() + " amount=" + p.amount()
                            + " minAmount=" + p.minAmount().toPlainString()));
        } catch (GatewayException e) {
            System.err.println("\n✗ " + e.getReason() + ": " + e.getMessage());
            exitCode = 1;
        } finally {
            registry.destroyAll();
            SharedStoreProvider.shutdown();
        }
        System.exit(exitCode);
    }

    private static void printPreflight(PreflightResult result) {
        if (result == null) {
            return;
        }
        System.out.println("预检查: " + result.state()
                + "  网络=" + result.networkOk()
                + "  密钥=" + result.apiKeyOk()
                + "  IP白名单=" + result.ipAllowed());
        if (result.error() != null) {
            System.out.println("  " + result.error().type() + ": " + result.error().message());
            System.out.println("  建议: " + result.error().suggestion());
        }
    }

    private static void printBalance(UnifiedBalance balance) {
        System.out.println("\n余额:");
        if (balance.getTotal().isEmpty()) {
            System.out.println("  (空)");
        }
        for (Map.Entry<String, BigDecimal> entry : balance.getTotal().entrySet()) {
            System.out.println("  " + entry.getKey() + ": total=" + entry.getValue().toPlainString()
                    + " free=" + balance.getFree(entry.getKey()).toPlainString());
        }
    }

    private static void printPositions(List<UnifiedPosition> positions) {
        System.out.println("\n持仓: " + positions.size());
        for (UnifiedPosition position : positions) {
            System.out.println("  " + position);
        }
    }
}
