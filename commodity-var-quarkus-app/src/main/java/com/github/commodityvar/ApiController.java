package com.github.commodityvar;

import com.github.commodityvar.dto.PriceRecord;
import com.github.commodityvar.dto.RiskRequest;
import com.github.commodityvar.market.OutlierReport;
import com.github.commodityvar.risk.VaRModel;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/api")
public class ApiController {

    private final VaRCalculationService varService;
    private final RiskEngineSettings settings;

    public ApiController(
            VaRCalculationService varService,
            RiskEngineSettings settings
    ) {
        this.varService = varService;
        this.settings = settings;
    }

    @POST
    @Path("/var")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public VaRReport calculate(RiskRequest request) {
        return varService.calculate(requireBody(request));
    }

    @POST
    @Path("/var/parametric")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public VaRReport calculateParametric(RiskRequest request) {
        return varService.calculate(requireBody(request), VaRModel.PARAMETRIC);
    }

    @POST
    @Path("/var/historical")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public VaRReport calculateHistorical(RiskRequest request) {
        return varService.calculate(requireBody(request), VaRModel.HISTORICAL);
    }

    @POST
    @Path("/outliers")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public OutlierReport detectOutliers(
            List<PriceRecord> prices,
            @QueryParam("threshold") Double threshold
    ) {
        if (prices == null) {
            throw new BadRequestException("Request body with prices is required");
        }
        return varService.detectOutliers(prices, threshold);
    }

    @GET
    @Path("/settings")
    @Produces(MediaType.APPLICATION_JSON)
    public RunSettings getSettings() {
        return settings.defaults();
    }

    private static RiskRequest requireBody(RiskRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body with positions and prices is required");
        }
        return request;
    }
}
