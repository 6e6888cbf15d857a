package com.rapidnpe;

import java.util.List;


final class CellPlacementJson {
    public String name;
    public Double x;
    public Double y;
    public Double width;
    public Double height;
    public Boolean rotated;
}

final class FloorplanEntryJson {
    public String npe;
    public String errorKind; // set only when the expression could not be evaluated
    public String errorMessage;
    public Double area;
    public Double width;
    public Double height;
    public Double deadSpaceRatio;
    public List<CellPlacementJson> placements;
}

public class FloorplanReportJson {
    public String designName;
    public Integer cellNum;
    public Double totalCellArea;
    public String bestNpe;
    public Double bestArea;
    public List<FloorplanEntryJson> floorplans;
}
