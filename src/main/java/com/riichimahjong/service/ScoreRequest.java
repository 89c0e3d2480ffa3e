package com.riichimahjong.service;

import java.util.List;

/**
 * 计分请求，HTTP 和 STOMP 共用
 */
public class ScoreRequest {
    private String clientId;
    private String concealed;          // 门内的牌（含和了牌），如 "234m567p789s345s11z"
    private List<MeldRequest> melds;
    private String winningTile;        // 如 "5p"
    private String seatWind;
    private String roundWind;
    private String winMethod;          // RON / TSUMO
    private String riichi;             // NONE / RIICHI / DOUBLE_RIICHI
    private boolean ippatsu;
    private boolean haitei;
    private boolean houtei;
    private boolean rinshan;
    private boolean chankan;
    private boolean tenhou;
    private boolean chiihou;
    private boolean renhou;
    private String doraIndicators;
    private String uraDoraIndicators;
    private int honba;
    private int riichiSticks;

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public String getConcealed() { return concealed; }
    public void setConcealed(String concealed) { this.concealed = concealed; }
    public List<MeldRequest> getMelds() { return melds; }
    public void setMelds(List<MeldRequest> melds) { this.melds = melds; }
    public String getWinningTile() { return winningTile; }
    public void setWinningTile(String winningTile) { this.winningTile = winningTile; }
    public String getSeatWind() { return seatWind; }
    public void setSeatWind(String seatWind) { this.seatWind = seatWind; }
    public String getRoundWind() { return roundWind; }
    public void setRoundWind(String roundWind) { this.roundWind = roundWind; }
    public String getWinMethod() { return winMethod; }
    public void setWinMethod(String winMethod) { this.winMethod = winMethod; }
    public String getRiichi() { return riichi; }
    public void setRiichi(String riichi) { this.riichi = riichi; }
    public boolean isIppatsu() { return ippatsu; }
    public void setIppatsu(boolean ippatsu) { this.ippatsu = ippatsu; }
    public boolean isHaitei() { return haitei; }
    public void setHaitei(boolean haitei) { this.haitei = haitei; }
    public boolean isHoutei() { return houtei; }
    public void setHoutei(boolean houtei) { this.houtei = houtei; }
    public boolean isRinshan() { return rinshan; }
    public void setRinshan(boolean rinshan) { this.rinshan = rinshan; }
    public boolean isChankan() { return chankan; }
    public void setChankan(boolean chankan) { this.chankan = chankan; }
    public boolean isTenhou() { return tenhou; }
    public void setTenhou(boolean tenhou) { this.tenhou = tenhou; }
    public boolean isChiihou() { return chiihou; }
    public void setChiihou(boolean chiihou) { this.chiihou = chiihou; }
    public boolean isRenhou() { return renhou; }
    public void setRenhou(boolean renhou) { this.renhou = renhou; }
    public String getDoraIndicators() { return doraIndicators; }
    public void setDoraIndicators(String doraIndicators) { this.doraIndicators = doraIndicators; }
    public String getUraDoraIndicators() { return uraDoraIndicators; }
    public void setUraDoraIndicators(String uraDoraIndicators) { this.uraDoraIndicators = uraDoraIndicators; }
    public int getHonba() { return honba; }
    public void setHonba(int honba) { this.honba = honba; }
    public int getRiichiSticks() { return riichiSticks; }
    public void setRiichiSticks(int riichiSticks) { this.riichiSticks = riichiSticks; }

    public static class MeldRequest {
        private String type;     // CHI / PON / KAN / ANKAN
        private String tiles;    // 如 "555z"

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getTiles() { return tiles; }
        public void setTiles(String tiles) { this.tiles = tiles; }
    }
}
