package world.willfrog.backtestmicro.backtestservice.constants;

public final class BacktestConstants {
    private BacktestConstants() {}

    /** 引擎内部金额、价格、份额的计算精度 */
    public static final int CALC_SCALE = 10;
    public static final int MONEY_SCALE = 2;
    public static final int RATIO_SCALE = 6;

    public static final double DAYS_PER_YEAR = 365.25;
    public static final int DEFAULT_TRADING_DAYS_PER_YEAR = 252;

    public static final int MAX_ERROR_LENGTH = 500;
    public static final String ISO_DATE = "yyyy-MM-dd";
    public static final String COMPACT_DATE = "yyyyMMdd";
}
